package com.carbonledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Repository for emission_summaries.
 */
public interface EmissionSummaryRepository extends MongoRepository<EmissionSummary, String>, EmissionSummaryRepositoryCustom {

    long countBySummaryType(SummaryType summaryType);
}
