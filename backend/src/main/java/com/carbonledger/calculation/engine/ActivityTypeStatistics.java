package com.carbonledger.calculation.engine;

import java.math.BigDecimal;

/**
 * Successful results and their summed co2e tonnes for one activity type.
 */
public record ActivityTypeStatistics(long count, BigDecimal totalCo2eTonnes) {

    static ActivityTypeStatistics empty() {
        return new ActivityTypeStatistics(0, BigDecimal.ZERO);
    }

    ActivityTypeStatistics plus(BigDecimal co2eTonnes) {
        return new ActivityTypeStatistics(count + 1, totalCo2eTonnes.add(co2eTonnes));
    }
}
