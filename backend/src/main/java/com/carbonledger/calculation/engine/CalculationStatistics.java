package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable counters for one batch or sweep. Keeps at most errorSampleLimit error records.
 */
class CalculationStatistics {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final int errorSampleLimit;
    private long processed;
    private long errors;
    private BigDecimal totalCo2eTonnes = BigDecimal.ZERO;
    private final Map<ActivityType, ActivityTypeStatistics> byActivityType = new EnumMap<>(ActivityType.class);
    private final List<CalculationError> errorSample = new ArrayList<>();

    CalculationStatistics(int errorSampleLimit) {
        this.errorSampleLimit = errorSampleLimit;
    }

    static CalculationStatistics unbounded() {
        return new CalculationStatistics(Integer.MAX_VALUE);
    }

    void recordSuccess(EmissionResult result) {
        processed++;
        totalCo2eTonnes = totalCo2eTonnes.add(result.getCo2eTonnes());
        byActivityType.merge(result.getActivityType(), ActivityTypeStatistics.empty().plus(result.getCo2eTonnes()),
                (current, single) -> current.plus(result.getCo2eTonnes()));
    }

    void recordError(CalculationError error) {
        errors++;
        if (errorSample.size() < errorSampleLimit) {
            errorSample.add(error);
        }
    }

    /** Fold a committed page into this sweep-wide accumulator. */
    void merge(CalculationStatistics page) {
        processed += page.processed;
        totalCo2eTonnes = totalCo2eTonnes.add(page.totalCo2eTonnes);
        page.byActivityType.forEach((type, stats) -> byActivityType.merge(type, stats,
                (a, b) -> new ActivityTypeStatistics(a.count() + b.count(), a.totalCo2eTonnes().add(b.totalCo2eTonnes()))));
        errors += page.errors;
        for (CalculationError error : page.errorSample) {
            if (errorSample.size() >= errorSampleLimit) {
                break;
            }
            errorSample.add(error);
        }
    }

    long processed() {
        return processed;
    }

    long errors() {
        return errors;
    }

    CalculationSummary toSummary(boolean cancelled) {
        long total = processed + errors;
        return new CalculationSummary(total, processed, errors, successRate(processed, total), totalCo2eTonnes,
                Collections.unmodifiableMap(new EnumMap<>(byActivityType)), List.copyOf(errorSample), cancelled);
    }

    static String successRate(long processed, long total) {
        if (total == 0) {
            return "0.00%";
        }
        BigDecimal rate = BigDecimal.valueOf(processed).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        return rate.toPlainString() + "%";
    }
}
