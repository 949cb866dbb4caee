package com.carbonledger.domain;

/**
 * Period granularity of an EmissionSummary. Custom summaries come from caller-supplied ranges and filters.
 */
public enum SummaryType {
    DAILY,
    WEEKLY,
    MONTHLY,
    YEARLY,
    CUSTOM
}
