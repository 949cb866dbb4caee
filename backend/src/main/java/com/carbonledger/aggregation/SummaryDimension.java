package com.carbonledger.aggregation;

import com.carbonledger.domain.ActivityType;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional filter combination of a summary. Null means "all".
 */
public record SummaryDimension(Integer scope, Integer category, ActivityType activityType) {

    public static final SummaryDimension ALL = new SummaryDimension(null, null, null);

    /**
     * Combinations materialized by daily and monthly aggregation: overall, scopes 2 and 3, Scope 3 categories
     * 1 and 6, each activity type, and each (scope, activity type) for scopes 2 and 3.
     */
    public static final List<SummaryDimension> STANDARD = standard();

    private static List<SummaryDimension> standard() {
        List<SummaryDimension> dimensions = new ArrayList<>();
        dimensions.add(ALL);
        for (int scope : new int[]{2, 3}) {
            dimensions.add(new SummaryDimension(scope, null, null));
        }
        dimensions.add(new SummaryDimension(3, 1, null));
        dimensions.add(new SummaryDimension(3, 6, null));
        for (ActivityType type : ActivityType.values()) {
            dimensions.add(new SummaryDimension(null, null, type));
        }
        for (int scope : new int[]{2, 3}) {
            for (ActivityType type : ActivityType.values()) {
                dimensions.add(new SummaryDimension(scope, null, type));
            }
        }
        return List.copyOf(dimensions);
    }
}
