package com.carbonledger.domain;

import java.time.LocalDate;
import java.util.Set;

/**
 * Application event: emission results were created or removed on the given UTC calculation dates.
 * Published after commit by the calculation engine and activity lifecycle; consumed by the summary refresh listener.
 */
public record EmissionResultsChangedEvent(Set<LocalDate> affectedDates) {

    public EmissionResultsChangedEvent {
        affectedDates = Set.copyOf(affectedDates);
    }
}
