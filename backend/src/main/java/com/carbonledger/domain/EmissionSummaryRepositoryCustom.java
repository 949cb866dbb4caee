package com.carbonledger.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Summary lookups where null dimensions must match stored nulls, or act as "no filter".
 */
public interface EmissionSummaryRepositoryCustom {

    /** Exact key lookup: a null dimension matches only rows where that dimension is null. */
    Optional<EmissionSummary> findByKey(SummaryKey key);

    /**
     * Summaries with fromDate &gt;= from and toDate &lt;= to. Null filters are not applied.
     * Ordered by fromDate then toDate.
     */
    List<EmissionSummary> findWithin(LocalDate from, LocalDate to, Integer scope, Integer category,
                                     ActivityType activityType, SummaryType summaryType);

    /** Most recent summary by toDate; null filters are not applied. */
    Optional<EmissionSummary> findLatest(Integer scope, Integer category, ActivityType activityType);
}
