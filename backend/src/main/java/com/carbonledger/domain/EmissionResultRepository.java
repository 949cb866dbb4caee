package com.carbonledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Repository for emission_results. Aggregations live in {@link EmissionResultRepositoryCustom}.
 */
public interface EmissionResultRepository extends MongoRepository<EmissionResult, String>, EmissionResultRepositoryCustom {

    boolean existsByActivityTypeAndActivityId(ActivityType activityType, String activityId);

    List<EmissionResult> findByActivityTypeAndActivityId(ActivityType activityType, String activityId);

    boolean existsByEmissionFactorId(String emissionFactorId);
}
