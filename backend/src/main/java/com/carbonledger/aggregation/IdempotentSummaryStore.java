package com.carbonledger.aggregation;

import com.carbonledger.domain.EmissionSummary;
import com.carbonledger.domain.EmissionSummaryRepository;
import com.carbonledger.domain.EmissionTotals;
import com.carbonledger.domain.SummaryKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Upsert of summary rows keyed by {@link SummaryKey}: an existing row has its totals replaced, otherwise a new
 * row is inserted. Repeating the same upsert leaves exactly one row with the same totals.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotentSummaryStore {

    static final int CO2E_SCALE = 7;

    private final EmissionSummaryRepository emissionSummaryRepository;

    public EmissionSummary upsert(SummaryKey key, EmissionTotals totals) {
        Instant now = Instant.now();
        Optional<EmissionSummary> existing = emissionSummaryRepository.findByKey(key);
        EmissionSummary summary = existing.orElseGet(() -> newSummary(key, now));
        summary.setTotalCo2eTonnes(totals.totalCo2eTonnes().setScale(CO2E_SCALE, RoundingMode.HALF_UP));
        summary.setActivityCount(totals.count());
        summary.setUpdatedAt(now);
        EmissionSummary saved = emissionSummaryRepository.save(summary);
        log.debug("{} summary {} {}..{} scope={} category={} type={}: {} t over {} results",
                existing.isPresent() ? "Updated" : "Created", key.summaryType(), key.fromDate(), key.toDate(),
                key.scope(), key.category(), key.activityType(), saved.getTotalCo2eTonnes(), saved.getActivityCount());
        return saved;
    }

    /** Delete the row for key if present; used when a refreshed period no longer has results. */
    public boolean removeIfPresent(SummaryKey key) {
        Optional<EmissionSummary> existing = emissionSummaryRepository.findByKey(key);
        existing.ifPresent(summary -> {
            emissionSummaryRepository.delete(summary);
            log.debug("Removed {} summary {}..{} scope={} category={} type={} with no remaining results",
                    key.summaryType(), key.fromDate(), key.toDate(), key.scope(), key.category(), key.activityType());
        });
        return existing.isPresent();
    }

    private static EmissionSummary newSummary(SummaryKey key, Instant now) {
        EmissionSummary summary = new EmissionSummary();
        summary.setFromDate(key.fromDate());
        summary.setToDate(key.toDate());
        summary.setScope(key.scope());
        summary.setCategory(key.category());
        summary.setActivityType(key.activityType());
        summary.setSummaryType(key.summaryType());
        summary.setCreatedAt(now);
        return summary;
    }
}
