package com.carbonledger.aggregation.report;

import com.carbonledger.domain.ActivityType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Live totals over every emission result, grouped by factor scope and Scope 3 category.
 */
public record EmissionReport(BigDecimal totalCo2eTonnes,
                             BigDecimal scope2Tonnes,
                             BigDecimal scope3Tonnes,
                             BigDecimal scope3Category1Tonnes,
                             BigDecimal scope3Category6Tonnes,
                             long totalActivities,
                             Map<ActivityType, BigDecimal> byActivityType,
                             LocalDate reportDate) {
}
