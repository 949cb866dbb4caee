package com.carbonledger.calculation.calculator;

import com.carbonledger.calculation.matcher.FactorMatch;
import com.carbonledger.calculation.matcher.FactorMatcher;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.ElectricityActivity;
import com.carbonledger.domain.EmissionFactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scope 2 electricity: usage_kwh × factor (kg CO2e/kWh) matched on country.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElectricityCalculator implements ActivityCalculator<ElectricityActivity> {

    private final FactorMatcher factorMatcher;

    @Override
    public ActivityType supportedType() {
        return ActivityType.ELECTRICITY;
    }

    @Override
    public Class<ElectricityActivity> activityClass() {
        return ElectricityActivity.class;
    }

    @Override
    public CalculationOutcome calculate(ElectricityActivity activity, int fuzzyThreshold) {
        if (activity.getUsageKwh() == null) {
            return CalculationOutcome.notCalculable("usage_kwh is missing");
        }
        Optional<FactorMatch> match = factorMatcher.match(ActivityType.ELECTRICITY, activity.getCountry(), fuzzyThreshold);
        if (match.isEmpty()) {
            log.warn("No emission factor for electricity activity {} country '{}'", activity.getId(), activity.getCountry());
            return CalculationOutcome.notCalculable("No emission factor found for country '" + activity.getCountry() + "'");
        }
        EmissionFactor factor = match.get().factor();
        BigDecimal co2e = EmissionFormula.co2eTonnes(activity.getUsageKwh(), factor.getCo2eFactor());

        Map<String, String> metadata = new LinkedHashMap<>();
        EmissionFormula.put(metadata, "usage_kwh", activity.getUsageKwh());
        EmissionFormula.put(metadata, "country", activity.getCountry());
        EmissionFormula.put(metadata, "matched_country", factor.getLookupIdentifier());
        EmissionFormula.put(metadata, "emission_factor_value", factor.getCo2eFactor());
        EmissionFormula.put(metadata, "unit", factor.getUnit());
        EmissionFormula.put(metadata, "calculation_method", match.get().calculationMethod());
        return CalculationOutcome.calculated(EmissionFormula.newResult(activity, match.get(), co2e, metadata));
    }
}
