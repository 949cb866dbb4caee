package com.carbonledger.factor;

import com.carbonledger.calculation.matcher.FactorCatalog;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionFactor;
import com.carbonledger.domain.EmissionFactorRepository;
import com.carbonledger.domain.EmissionResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Administrative maintenance of emission factors. A factor referenced by any result cannot be deleted.
 * Every change evicts the factor cache used by matching.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmissionFactorAdminService {

    static final int FACTOR_SCALE = 6;

    private final EmissionFactorRepository emissionFactorRepository;
    private final EmissionResultRepository emissionResultRepository;
    private final FactorCatalog factorCatalog;

    public EmissionFactor create(EmissionFactor factor) {
        validate(factor);
        Instant now = Instant.now();
        factor.setId(null);
        factor.setCo2eFactor(factor.getCo2eFactor().setScale(FACTOR_SCALE, RoundingMode.HALF_UP));
        factor.setCreatedAt(now);
        factor.setUpdatedAt(now);
        EmissionFactor saved = emissionFactorRepository.save(factor);
        factorCatalog.evictAll();
        log.info("Created emission factor {} for {} '{}'", saved.getId(), saved.getActivityType(), saved.getLookupIdentifier());
        return saved;
    }

    /**
     * Replace the mutable attributes of an existing factor with those of changes.
     *
     * @throws EmissionFactorAdminException FACTOR_NOT_FOUND, INVALID_FACTOR
     */
    public EmissionFactor update(String id, EmissionFactor changes) {
        EmissionFactor existing = emissionFactorRepository.findById(id)
                .orElseThrow(() -> notFound(id));
        validate(changes);
        existing.setActivityType(changes.getActivityType());
        existing.setLookupIdentifier(changes.getLookupIdentifier());
        existing.setUnit(changes.getUnit());
        existing.setCo2eFactor(changes.getCo2eFactor().setScale(FACTOR_SCALE, RoundingMode.HALF_UP));
        existing.setScope(changes.getScope());
        existing.setCategory(changes.getCategory());
        existing.setSource(changes.getSource());
        existing.setNotes(changes.getNotes());
        existing.setUpdatedAt(Instant.now());
        EmissionFactor saved = emissionFactorRepository.save(existing);
        factorCatalog.evictAll();
        log.info("Updated emission factor {}", id);
        return saved;
    }

    public Optional<EmissionFactor> get(String id) {
        return emissionFactorRepository.findById(id);
    }

    public List<EmissionFactor> listByActivityType(ActivityType activityType) {
        return emissionFactorRepository.findByActivityType(activityType);
    }

    /** Factors of a scope, optionally narrowed to one category. */
    public List<EmissionFactor> listByScope(int scope, Integer category) {
        return category == null
                ? emissionFactorRepository.findByScope(scope)
                : emissionFactorRepository.findByScopeAndCategory(scope, category);
    }

    /**
     * @throws EmissionFactorAdminException FACTOR_NOT_FOUND, or FACTOR_IN_USE while any result references it
     */
    public void delete(String id) {
        if (!emissionFactorRepository.existsById(id)) {
            throw notFound(id);
        }
        if (emissionResultRepository.existsByEmissionFactorId(id)) {
            throw new EmissionFactorAdminException(EmissionFactorAdminException.FACTOR_IN_USE,
                    "Emission factor " + id + " is referenced by emission results");
        }
        emissionFactorRepository.deleteById(id);
        factorCatalog.evictAll();
        log.info("Deleted emission factor {}", id);
    }

    private static void validate(EmissionFactor factor) {
        if (factor == null) {
            throw invalid("factor is required");
        }
        if (factor.getActivityType() == null) {
            throw invalid("activityType is required");
        }
        if (factor.getLookupIdentifier() == null || factor.getLookupIdentifier().isBlank()) {
            throw invalid("lookupIdentifier must not be blank");
        }
        if (factor.getUnit() == null || factor.getUnit().isBlank()) {
            throw invalid("unit must not be blank");
        }
        if (factor.getCo2eFactor() == null || factor.getCo2eFactor().signum() < 0) {
            throw invalid("co2eFactor must be zero or positive");
        }
        if (factor.getScope() < 1 || factor.getScope() > 3) {
            throw invalid("scope must be 1, 2 or 3");
        }
        if (factor.getCategory() != null && factor.getCategory() < 1) {
            throw invalid("category must be positive");
        }
    }

    private static EmissionFactorAdminException invalid(String message) {
        return new EmissionFactorAdminException(EmissionFactorAdminException.INVALID_FACTOR, message);
    }

    private static EmissionFactorAdminException notFound(String id) {
        return new EmissionFactorAdminException(EmissionFactorAdminException.FACTOR_NOT_FOUND,
                "Emission factor not found: " + id);
    }
}
