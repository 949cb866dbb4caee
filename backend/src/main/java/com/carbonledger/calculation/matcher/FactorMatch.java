package com.carbonledger.calculation.matcher;

import com.carbonledger.domain.EmissionFactor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Matched factor with its confidence (scale 2, 0..1). Confidence 1.00 only for exact matches.
 */
public record FactorMatch(EmissionFactor factor, BigDecimal confidence, MatchMethod method) {

    public FactorMatch {
        Objects.requireNonNull(factor, "factor");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(method, "method");
    }

    public boolean isExact() {
        return confidence.compareTo(BigDecimal.ONE) == 0;
    }

    /** "exact" when confidence is 1.00, otherwise "fuzzy"; recorded as calculation_method. */
    public String calculationMethod() {
        return isExact() ? "exact" : "fuzzy";
    }
}
