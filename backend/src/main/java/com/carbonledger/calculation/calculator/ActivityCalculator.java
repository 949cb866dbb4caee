package com.carbonledger.calculation.calculator;

import com.carbonledger.domain.ActivityRecord;
import com.carbonledger.domain.ActivityType;

/**
 * Converts one activity variant into an unsaved EmissionResult. Implementations are registered in the
 * calculation engine's dispatch map by {@link #supportedType()}.
 */
public interface ActivityCalculator<A extends ActivityRecord> {

    ActivityType supportedType();

    Class<A> activityClass();

    /**
     * @param fuzzyThreshold minimum fuzzy score (0..100) accepted by the factor matcher
     * @return calculated outcome carrying the new result, or notCalculable with the reason
     */
    CalculationOutcome calculate(A activity, int fuzzyThreshold);
}
