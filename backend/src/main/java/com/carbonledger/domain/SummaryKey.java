package com.carbonledger.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identity of one summary row. Null dimensions mean "all" and take part in the identity as null.
 */
public record SummaryKey(LocalDate fromDate, LocalDate toDate, Integer scope, Integer category,
                         ActivityType activityType, SummaryType summaryType) {

    public SummaryKey {
        Objects.requireNonNull(fromDate, "fromDate");
        Objects.requireNonNull(toDate, "toDate");
        Objects.requireNonNull(summaryType, "summaryType");
    }
}
