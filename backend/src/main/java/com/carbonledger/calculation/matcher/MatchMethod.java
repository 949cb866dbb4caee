package com.carbonledger.calculation.matcher;

/**
 * Tier that produced a factor match.
 */
public enum MatchMethod {
    EXACT,
    FUZZY,
    PARTIAL
}
