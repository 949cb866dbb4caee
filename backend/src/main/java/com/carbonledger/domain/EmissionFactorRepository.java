package com.carbonledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Repository for emission_factors.
 */
public interface EmissionFactorRepository extends MongoRepository<EmissionFactor, String> {

    List<EmissionFactor> findByActivityType(ActivityType activityType);

    List<EmissionFactor> findByScope(int scope);

    List<EmissionFactor> findByScopeAndCategory(int scope, Integer category);
}
