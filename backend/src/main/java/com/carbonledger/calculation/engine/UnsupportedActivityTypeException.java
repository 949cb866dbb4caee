package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityRef;

/**
 * No calculator is registered for the activity's type. A configuration error.
 */
public class UnsupportedActivityTypeException extends EmissionCalculationException {

    public UnsupportedActivityTypeException(ActivityRef activityRef) {
        super(activityRef, "no calculator registered for activity type " + activityRef.type());
    }
}
