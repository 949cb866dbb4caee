package com.carbonledger.calculation.matcher;

import com.carbonledger.common.TokenSortRatio;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionFactor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a lookup key to an emission factor: exact (case-insensitive) first, token-sort fuzzy second.
 * Air travel adds a containment tier below fuzzy. Absence is Optional.empty(), never an exception.
 * <p>
 * Ties (duplicate identifiers on exact match, equal scores on fuzzy match) resolve to the lowest
 * lookupIdentifier case-insensitively, then the lowest id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactorMatcher {

    public static final BigDecimal EXACT_CONFIDENCE = new BigDecimal("1.00");
    public static final BigDecimal PARTIAL_CONFIDENCE = new BigDecimal("0.90");
    static final BigDecimal MAX_FUZZY_CONFIDENCE = new BigDecimal("0.99");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    static final Comparator<EmissionFactor> CANDIDATE_ORDER = Comparator
            .comparing((EmissionFactor f) -> identifierOf(f).toLowerCase(Locale.ROOT))
            .thenComparing(EmissionFactor::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FactorCatalog factorCatalog;

    /**
     * @param threshold minimum fuzzy score (0..100) for a fuzzy match to be accepted
     */
    public Optional<FactorMatch> match(ActivityType activityType, String lookupKey, int threshold) {
        if (lookupKey == null || lookupKey.isBlank()) {
            return Optional.empty();
        }
        List<EmissionFactor> factors = factorCatalog.factorsFor(activityType);
        if (factors.isEmpty()) {
            log.debug("No emission factors for {}", activityType);
            return Optional.empty();
        }
        String key = lookupKey.strip();

        Optional<EmissionFactor> exact = factors.stream()
                .filter(f -> identifierOf(f).equalsIgnoreCase(key))
                .min(CANDIDATE_ORDER);
        if (exact.isPresent()) {
            log.debug("Exact factor match for {} '{}' -> {}", activityType, key, exact.get().getId());
            return Optional.of(new FactorMatch(exact.get(), EXACT_CONFIDENCE, MatchMethod.EXACT));
        }
        return fuzzyMatch(activityType, key, factors, threshold);
    }

    /**
     * Air travel lookup on "{flightRange}, {passengerClass}". When exact and fuzzy both fail, the first factor
     * (in tie-break order) whose identifier contains both parts case-insensitively matches with confidence 0.90.
     */
    public Optional<FactorMatch> matchAirTravel(String flightRange, String passengerClass, int threshold) {
        String range = flightRange == null ? "" : flightRange.strip();
        String travelClass = passengerClass == null ? "" : passengerClass.strip();
        Optional<FactorMatch> composite = match(ActivityType.AIR_TRAVEL, range + ", " + travelClass, threshold);
        if (composite.isPresent() || range.isEmpty() || travelClass.isEmpty()) {
            return composite;
        }
        String rangeLower = range.toLowerCase(Locale.ROOT);
        String classLower = travelClass.toLowerCase(Locale.ROOT);
        return factorCatalog.factorsFor(ActivityType.AIR_TRAVEL).stream()
                .sorted(CANDIDATE_ORDER)
                .filter(f -> {
                    String identifier = identifierOf(f).toLowerCase(Locale.ROOT);
                    return identifier.contains(rangeLower) && identifier.contains(classLower);
                })
                .findFirst()
                .map(f -> {
                    log.debug("Partial air travel factor match '{}, {}' -> {}", range, travelClass, f.getId());
                    return new FactorMatch(f, PARTIAL_CONFIDENCE, MatchMethod.PARTIAL);
                });
    }

    private Optional<FactorMatch> fuzzyMatch(ActivityType activityType, String key, List<EmissionFactor> factors,
                                             int threshold) {
        EmissionFactor best = null;
        double bestScore = -1;
        for (EmissionFactor candidate : factors) {
            double score = TokenSortRatio.score(key, identifierOf(candidate));
            if (score > bestScore || (score == bestScore && CANDIDATE_ORDER.compare(candidate, best) < 0)) {
                best = candidate;
                bestScore = score;
            }
        }
        if (best == null || bestScore < threshold) {
            log.debug("No fuzzy factor match for {} '{}' (best score {})", activityType, key, bestScore);
            return Optional.empty();
        }
        BigDecimal confidence = BigDecimal.valueOf(bestScore)
                .divide(HUNDRED, 2, RoundingMode.HALF_UP)
                .min(MAX_FUZZY_CONFIDENCE);
        log.debug("Fuzzy factor match for {} '{}' -> {} score {}", activityType, key, best.getId(), bestScore);
        return Optional.of(new FactorMatch(best, confidence, MatchMethod.FUZZY));
    }

    private static String identifierOf(EmissionFactor factor) {
        return factor.getLookupIdentifier() == null ? "" : factor.getLookupIdentifier();
    }
}
