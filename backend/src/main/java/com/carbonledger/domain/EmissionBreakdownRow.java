package com.carbonledger.domain;

import java.math.BigDecimal;

/**
 * One group of the live report pipeline. category is null for factors without a Scope 3 category.
 */
public record EmissionBreakdownRow(ActivityType activityType, Integer scope, Integer category,
                                   BigDecimal totalCo2eTonnes, long count) {
}
