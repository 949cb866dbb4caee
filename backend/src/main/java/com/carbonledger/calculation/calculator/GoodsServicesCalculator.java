package com.carbonledger.calculation.calculator;

import com.carbonledger.calculation.matcher.FactorMatch;
import com.carbonledger.calculation.matcher.FactorMatcher;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionFactor;
import com.carbonledger.domain.GoodsServicesActivity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scope 3 category 1, spend based: spend_amount × factor (kg CO2e per currency unit) matched on supplier category.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GoodsServicesCalculator implements ActivityCalculator<GoodsServicesActivity> {

    private final FactorMatcher factorMatcher;

    @Override
    public ActivityType supportedType() {
        return ActivityType.GOODS_SERVICES;
    }

    @Override
    public Class<GoodsServicesActivity> activityClass() {
        return GoodsServicesActivity.class;
    }

    @Override
    public CalculationOutcome calculate(GoodsServicesActivity activity, int fuzzyThreshold) {
        if (activity.getSpendAmount() == null) {
            return CalculationOutcome.notCalculable("spend_amount is missing");
        }
        Optional<FactorMatch> match = factorMatcher.match(
                ActivityType.GOODS_SERVICES, activity.getSupplierCategory(), fuzzyThreshold);
        if (match.isEmpty()) {
            log.warn("No emission factor for goods/services activity {} category '{}'",
                    activity.getId(), activity.getSupplierCategory());
            return CalculationOutcome.notCalculable(
                    "No emission factor found for supplier category '" + activity.getSupplierCategory() + "'");
        }
        EmissionFactor factor = match.get().factor();
        BigDecimal co2e = EmissionFormula.co2eTonnes(activity.getSpendAmount(), factor.getCo2eFactor());

        Map<String, String> metadata = new LinkedHashMap<>();
        EmissionFormula.put(metadata, "spend_gbp", activity.getSpendAmount());
        EmissionFormula.put(metadata, "supplier_category", activity.getSupplierCategory());
        EmissionFormula.put(metadata, "matched_category", factor.getLookupIdentifier());
        EmissionFormula.put(metadata, "emission_factor_value", factor.getCo2eFactor());
        EmissionFormula.put(metadata, "unit", factor.getUnit());
        EmissionFormula.put(metadata, "calculation_method", match.get().calculationMethod());
        return CalculationOutcome.calculated(EmissionFormula.newResult(activity, match.get(), co2e, metadata));
    }
}
