package com.carbonledger.domain;

/**
 * Persistence for AirTravelActivity.
 */
public interface AirTravelActivityRepository extends ActivityRepository<AirTravelActivity> {
}
