package com.carbonledger.aggregation.query;

import java.math.BigDecimal;

/**
 * Sum of stored summaries: co2e tonnes, activity count and how many summary rows were added up.
 */
public record SummaryTotals(BigDecimal totalCo2eTonnes, long activityCount, int summariesAggregated) {

    static final SummaryTotals EMPTY = new SummaryTotals(BigDecimal.ZERO, 0, 0);

    SummaryTotals plus(BigDecimal co2eTonnes, long activities) {
        return new SummaryTotals(totalCo2eTonnes.add(co2eTonnes), activityCount + activities, summariesAggregated + 1);
    }
}
