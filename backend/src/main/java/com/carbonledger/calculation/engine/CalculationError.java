package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityType;

/**
 * Per-activity failure record in a batch or sweep.
 */
public record CalculationError(String activityId, ActivityType activityType, String error) {
}
