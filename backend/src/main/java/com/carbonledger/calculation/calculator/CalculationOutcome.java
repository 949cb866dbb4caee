package com.carbonledger.calculation.calculator;

import com.carbonledger.domain.EmissionResult;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one calculator call: a new EmissionResult, or the reason it could not be calculated
 * (no matching factor, missing quantity). Not calculable is an expected outcome, not an error.
 */
public final class CalculationOutcome {

    private final EmissionResult result;
    private final String reason;

    private CalculationOutcome(EmissionResult result, String reason) {
        this.result = result;
        this.reason = reason;
    }

    public static CalculationOutcome calculated(EmissionResult result) {
        return new CalculationOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static CalculationOutcome notCalculable(String reason) {
        return new CalculationOutcome(null, reason);
    }

    public boolean isCalculated() {
        return result != null;
    }

    public Optional<EmissionResult> getResult() {
        return Optional.ofNullable(result);
    }

    public String getReason() {
        return reason;
    }
}
