package com.carbonledger.calculation.calculator;

import com.carbonledger.calculation.matcher.FactorMatch;
import com.carbonledger.common.UnitNormalizer;
import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.EmissionResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Map;

/**
 * co2e_tonnes = normalize(quantity) × co2e_factor / 1000, 7 fractional digits, and result assembly shared by
 * the calculators.
 */
final class EmissionFormula {

    static final int CO2E_SCALE = 7;

    private EmissionFormula() {
    }

    static BigDecimal co2eTonnes(Object quantity, BigDecimal co2eFactor) {
        BigDecimal kg = UnitNormalizer.normalize(quantity).multiply(co2eFactor);
        return UnitNormalizer.kgToTonnes(kg, CO2E_SCALE);
    }

    static EmissionResult newResult(ActivityRecord activity, FactorMatch match, BigDecimal co2eTonnes,
                                    Map<String, String> metadata) {
        Instant now = Instant.now();
        EmissionResult result = new EmissionResult();
        result.setActivityType(activity.getActivityType());
        result.setActivityId(activity.getId());
        result.setEmissionFactorId(match.factor().getId());
        result.setCo2eTonnes(co2eTonnes);
        result.setConfidenceScore(match.confidence().setScale(2, RoundingMode.HALF_UP));
        result.getCalculationMetadata().putAll(metadata);
        result.setCalculationDate(now);
        result.setCreatedAt(now);
        result.setUpdatedAt(now);
        return result;
    }

    /** Metadata values are plain decimal text; null values are left out. */
    static void put(Map<String, String> metadata, String key, Object value) {
        if (value == null) {
            return;
        }
        metadata.put(key, value instanceof BigDecimal decimal ? decimal.toPlainString() : value.toString());
    }
}
