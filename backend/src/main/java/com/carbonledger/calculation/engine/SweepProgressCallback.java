package com.carbonledger.calculation.engine;

import com.carbonledger.domain.ActivityType;

/**
 * Called after each sweep page commits. trackedRecords is the number of activities and results held in
 * memory for that page, before they are released.
 */
@FunctionalInterface
public interface SweepProgressCallback {

    SweepProgressCallback NONE = (partition, pageIndex, trackedRecords, processedSoFar) -> { };

    void pageCommitted(ActivityType partition, int pageIndex, int trackedRecords, long processedSoFar);
}
