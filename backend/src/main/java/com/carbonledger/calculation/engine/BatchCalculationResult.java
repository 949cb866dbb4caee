package com.carbonledger.calculation.engine;

import com.carbonledger.domain.EmissionResult;

import java.util.List;

/**
 * Results (new and already existing) of a batch plus its statistics and errors.
 */
public record BatchCalculationResult(List<EmissionResult> results, CalculationSummary summary) {
}
