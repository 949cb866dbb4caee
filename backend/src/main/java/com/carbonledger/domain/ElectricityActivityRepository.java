package com.carbonledger.domain;

/**
 * Persistence for ElectricityActivity.
 */
public interface ElectricityActivityRepository extends ActivityRepository<ElectricityActivity> {
}
