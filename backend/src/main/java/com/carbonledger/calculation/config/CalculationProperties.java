package com.carbonledger.calculation.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Calculation module configuration. Documented in application.yml under carbonledger.calculation.
 */
@ConfigurationProperties(prefix = "carbonledger.calculation")
@Validated
@Getter
@Setter
public class CalculationProperties {

    /**
     * Minimum token-sort score (0..100) for a fuzzy factor match.
     */
    @Min(0)
    @Max(100)
    private int fuzzyThreshold = 80;

    /**
     * Page size for full-population sweeps; one transaction per page.
     */
    @Positive
    private int batchSize = 100;

    /**
     * Cap on records loaded at once by the in-memory (legacy) sweep.
     */
    @Positive
    private int legacyMaxRecords = 10_000;

    /**
     * Failure records kept by a streaming sweep; further failures are only counted.
     */
    @Min(0)
    private int errorSampleSize = 10;

    private SweepProperties sweep = new SweepProperties();

    @Getter
    @Setter
    public static class SweepProperties {
        /** Run the scheduled streaming sweep of activities without results. */
        private boolean enabled = false;
        /** Delay between the end of one sweep and the start of the next. */
        private long intervalMs = 300_000;
        private long initialDelayMs = 60_000;
    }
}
