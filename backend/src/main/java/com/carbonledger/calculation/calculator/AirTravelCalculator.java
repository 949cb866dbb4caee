package com.carbonledger.calculation.calculator;

import com.carbonledger.calculation.matcher.FactorMatch;
import com.carbonledger.calculation.matcher.FactorMatcher;
import com.carbonledger.common.UnitNormalizer;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.AirTravelActivity;
import com.carbonledger.domain.AirTravelActivityRepository;
import com.carbonledger.domain.EmissionFactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scope 3 category 6: distance_km × factor (kg CO2e per passenger km) matched on "{flight range}, {class}".
 * A missing or zero distance_km is backfilled from a positive distance_miles and persisted on the activity.
 * Zero distance yields zero emissions; only the absence of both distances is not calculable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AirTravelCalculator implements ActivityCalculator<AirTravelActivity> {

    private final FactorMatcher factorMatcher;
    private final AirTravelActivityRepository airTravelActivityRepository;

    @Override
    public ActivityType supportedType() {
        return ActivityType.AIR_TRAVEL;
    }

    @Override
    public Class<AirTravelActivity> activityClass() {
        return AirTravelActivity.class;
    }

    @Override
    public CalculationOutcome calculate(AirTravelActivity activity, int fuzzyThreshold) {
        BigDecimal km = activity.getDistanceKm();
        BigDecimal miles = activity.getDistanceMiles();
        if (km == null && miles == null) {
            return CalculationOutcome.notCalculable("Both distance_km and distance_miles are missing");
        }
        if ((km == null || km.signum() == 0) && miles != null && miles.signum() > 0) {
            km = UnitNormalizer.milesToKm(miles);
            activity.setDistanceKm(km);
            activity.setUpdatedAt(Instant.now());
            airTravelActivityRepository.save(activity);
            log.debug("Backfilled distance_km={} from distance_miles={} for air travel activity {}",
                    km, miles, activity.getId());
        } else if (km == null) {
            km = BigDecimal.ZERO.setScale(UnitNormalizer.DISTANCE_SCALE);
        }

        Optional<FactorMatch> match = factorMatcher.matchAirTravel(
                activity.getFlightRange(), activity.getPassengerClass(), fuzzyThreshold);
        if (match.isEmpty()) {
            log.warn("No emission factor for air travel activity {} '{}, {}'",
                    activity.getId(), activity.getFlightRange(), activity.getPassengerClass());
            return CalculationOutcome.notCalculable("No emission factor found for '"
                    + activity.getFlightRange() + ", " + activity.getPassengerClass() + "'");
        }
        EmissionFactor factor = match.get().factor();
        BigDecimal co2e = EmissionFormula.co2eTonnes(km, factor.getCo2eFactor());

        Map<String, String> metadata = new LinkedHashMap<>();
        EmissionFormula.put(metadata, "distance_km", km);
        EmissionFormula.put(metadata, "distance_miles", miles);
        EmissionFormula.put(metadata, "flight_range", activity.getFlightRange());
        EmissionFormula.put(metadata, "passenger_class", activity.getPassengerClass());
        EmissionFormula.put(metadata, "matched_identifier", factor.getLookupIdentifier());
        EmissionFormula.put(metadata, "emission_factor_value", factor.getCo2eFactor());
        EmissionFormula.put(metadata, "unit", factor.getUnit());
        EmissionFormula.put(metadata, "calculation_method", match.get().calculationMethod());
        return CalculationOutcome.calculated(EmissionFormula.newResult(activity, match.get(), co2e, metadata));
    }
}
