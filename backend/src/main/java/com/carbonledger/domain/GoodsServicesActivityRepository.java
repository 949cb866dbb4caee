package com.carbonledger.domain;

/**
 * Persistence for GoodsServicesActivity.
 */
public interface GoodsServicesActivityRepository extends ActivityRepository<GoodsServicesActivity> {
}
