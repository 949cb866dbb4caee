package com.carbonledger.aggregation;

import com.carbonledger.domain.EmissionResultRepository;
import com.carbonledger.domain.EmissionSummary;
import com.carbonledger.domain.EmissionTotals;
import com.carbonledger.domain.SummaryKey;
import com.carbonledger.domain.SummaryType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recomputes summary rows from emission results. A period is [fromDate, toDate] in whole UTC days, matched
 * against result calculationDate. Periods without results produce no row; existing rows are updated in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmissionAggregationService {

    private final EmissionResultRepository emissionResultRepository;
    private final IdempotentSummaryStore idempotentSummaryStore;

    /**
     * Aggregate one period and dimension combination.
     *
     * @return the created or updated summary; empty when no result matches (nothing is written)
     */
    public Optional<EmissionSummary> aggregatePeriod(LocalDate fromDate, LocalDate toDate,
                                                     SummaryDimension dimension, SummaryType summaryType) {
        validateRange(fromDate, toDate);
        EmissionTotals totals = totalsFor(fromDate, toDate, dimension);
        if (totals.isEmpty()) {
            log.debug("No results for {} {}..{} {}", summaryType, fromDate, toDate, dimension);
            return Optional.empty();
        }
        return Optional.of(idempotentSummaryStore.upsert(keyOf(fromDate, toDate, dimension, summaryType), totals));
    }

    /** Standard dimension combinations for one day, tagged DAILY. */
    public List<EmissionSummary> aggregateDaily(LocalDate day) {
        log.info("Aggregating daily emissions for {}", day);
        return aggregateStandard(day, day, SummaryType.DAILY, false);
    }

    /** Standard dimension combinations over a calendar month, tagged MONTHLY. */
    public List<EmissionSummary> aggregateMonthly(int year, int month) {
        YearMonth yearMonth = yearMonth(year, month);
        log.info("Aggregating monthly emissions for {}", yearMonth);
        return aggregateStandard(yearMonth.atDay(1), yearMonth.atEndOfMonth(), SummaryType.MONTHLY, false);
    }

    /** Arbitrary range and filters, always tagged CUSTOM. */
    public Optional<EmissionSummary> aggregateCustom(LocalDate fromDate, LocalDate toDate, SummaryDimension dimension) {
        return aggregatePeriod(fromDate, toDate, dimension, SummaryType.CUSTOM);
    }

    /**
     * Run daily or monthly aggregation for every period touching [fromDate, toDate], one period at a time.
     *
     * @param granularity DAILY or MONTHLY
     */
    public List<EmissionSummary> backfill(LocalDate fromDate, LocalDate toDate, SummaryType granularity) {
        validateRange(fromDate, toDate);
        List<EmissionSummary> summaries = new ArrayList<>();
        switch (granularity) {
            case DAILY -> {
                for (LocalDate day = fromDate; !day.isAfter(toDate); day = day.plusDays(1)) {
                    summaries.addAll(aggregateDaily(day));
                }
            }
            case MONTHLY -> {
                YearMonth last = YearMonth.from(toDate);
                for (YearMonth month = YearMonth.from(fromDate); !month.isAfter(last); month = month.plusMonths(1)) {
                    summaries.addAll(aggregateMonthly(month.getYear(), month.getMonthValue()));
                }
            }
            default -> throw new IllegalArgumentException("Backfill supports DAILY or MONTHLY, not " + granularity);
        }
        log.info("Backfill {} {}..{} wrote {} summaries", granularity, fromDate, toDate, summaries.size());
        return summaries;
    }

    /**
     * Daily aggregation for a day whose results changed. Rows whose combination no longer has any result
     * are removed so summaries stay consistent with results.
     */
    public List<EmissionSummary> refreshDaily(LocalDate day) {
        return aggregateStandard(day, day, SummaryType.DAILY, true);
    }

    /** Monthly counterpart of {@link #refreshDaily(LocalDate)}. */
    public List<EmissionSummary> refreshMonthly(YearMonth month) {
        return aggregateStandard(month.atDay(1), month.atEndOfMonth(), SummaryType.MONTHLY, true);
    }

    private List<EmissionSummary> aggregateStandard(LocalDate fromDate, LocalDate toDate, SummaryType summaryType,
                                                    boolean removeEmpty) {
        List<EmissionSummary> summaries = new ArrayList<>();
        for (SummaryDimension dimension : SummaryDimension.STANDARD) {
            EmissionTotals totals = totalsFor(fromDate, toDate, dimension);
            SummaryKey key = keyOf(fromDate, toDate, dimension, summaryType);
            if (totals.isEmpty()) {
                if (removeEmpty) {
                    idempotentSummaryStore.removeIfPresent(key);
                }
                continue;
            }
            summaries.add(idempotentSummaryStore.upsert(key, totals));
        }
        log.info("{} aggregation {}..{}: {} summaries written", summaryType, fromDate, toDate, summaries.size());
        return summaries;
    }

    private EmissionTotals totalsFor(LocalDate fromDate, LocalDate toDate, SummaryDimension dimension) {
        Instant fromInclusive = fromDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant toExclusive = toDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return emissionResultRepository.aggregateTotals(fromInclusive, toExclusive,
                dimension.scope(), dimension.category(), dimension.activityType());
    }

    private static SummaryKey keyOf(LocalDate fromDate, LocalDate toDate, SummaryDimension dimension,
                                    SummaryType summaryType) {
        return new SummaryKey(fromDate, toDate, dimension.scope(), dimension.category(),
                dimension.activityType(), summaryType);
    }

    private static void validateRange(LocalDate fromDate, LocalDate toDate) {
        if (fromDate == null || toDate == null) {
            throw new IllegalArgumentException("fromDate and toDate are required");
        }
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
    }

    static YearMonth yearMonth(int year, int month) {
        try {
            return YearMonth.of(year, month);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid month " + year + "-" + month, e);
        }
    }
}
