package com.carbonledger.domain;

import java.time.Instant;
import java.util.List;

/**
 * MongoTemplate aggregations over emission_results joined to emission_factors.
 */
public interface EmissionResultRepositoryCustom {

    /**
     * SUM(co2eTonnes) and COUNT over results with calculationDate in [fromInclusive, toExclusive), joined to their
     * factor. Null filters are not applied. Returns {@link EmissionTotals#empty()} when nothing matches.
     */
    EmissionTotals aggregateTotals(Instant fromInclusive, Instant toExclusive,
                                   Integer scope, Integer category, ActivityType activityType);

    /** Totals over every result grouped by (activityType, factor scope, factor category). */
    List<EmissionBreakdownRow> aggregateByTypeScopeAndCategory();

    /** Activity ids that already have a result, capped at limit. Used by the bounded in-memory sweep. */
    List<String> findActivityIdsWithResults(ActivityType activityType, int limit);
}
