package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Statistics returned by batch and sweep operations.
 *
 * @param totalActivities activities attempted (processed + errors)
 * @param successRate     processed / total as a percentage with 2 decimals, e.g. "50.00%"
 * @param errors          failure records; a streaming sweep keeps only a bounded sample
 * @param cancelled       true when a sweep stopped at a page boundary on request
 */
public record CalculationSummary(long totalActivities,
                                 long totalProcessed,
                                 long totalErrors,
                                 String successRate,
                                 BigDecimal totalCo2eTonnes,
                                 Map<ActivityType, ActivityTypeStatistics> byActivityType,
                                 List<CalculationError> errors,
                                 boolean cancelled) {
}
