package com.carbonledger.aggregation.query;

/**
 * Dimension used to group summaries in a breakdown.
 */
public enum BreakdownDimension {
    SCOPE,
    CATEGORY,
    ACTIVITY
}
