package com.carbonledger.calculation.matcher;

import com.carbonledger.config.CaffeineConfig;
import com.carbonledger.domain.ActivityType;
import com.carbonledger.domain.EmissionFactor;
import com.carbonledger.domain.EmissionFactorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read-only view of emission factors per activity type, cached in Caffeine.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactorCatalog {

    private final EmissionFactorRepository emissionFactorRepository;

    @Cacheable(cacheNames = CaffeineConfig.EMISSION_FACTORS_BY_TYPE_CACHE, key = "#activityType")
    public List<EmissionFactor> factorsFor(ActivityType activityType) {
        List<EmissionFactor> factors = List.copyOf(emissionFactorRepository.findByActivityType(activityType));
        log.debug("Loaded {} emission factors for {}", factors.size(), activityType);
        return factors;
    }

    @CacheEvict(cacheNames = CaffeineConfig.EMISSION_FACTORS_BY_TYPE_CACHE, allEntries = true)
    public void evictAll() {
        log.debug("Evicted emission factor cache");
    }
}
