package com.carbonledger.domain;

import java.math.BigDecimal;

/**
 * Sum of co2e tonnes and number of results from one aggregate query.
 */
public record EmissionTotals(BigDecimal totalCo2eTonnes, long count) {

    public static EmissionTotals empty() {
        return new EmissionTotals(BigDecimal.ZERO, 0L);
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
