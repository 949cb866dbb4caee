package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityRef;
import lombok.Getter;

/**
 * Calculation of one activity failed unexpectedly. Carries the activity reference and the original cause.
 */
@Getter
public class EmissionCalculationException extends RuntimeException {

    private final ActivityRef activityRef;

    public EmissionCalculationException(ActivityRef activityRef, String reason, Throwable cause) {
        super("Failed to calculate emissions for " + activityRef.type().getDisplayName()
                + " activity " + activityRef.id() + ": " + reason, cause);
        this.activityRef = activityRef;
    }

    public EmissionCalculationException(ActivityRef activityRef, String reason) {
        this(activityRef, reason, null);
    }
}
