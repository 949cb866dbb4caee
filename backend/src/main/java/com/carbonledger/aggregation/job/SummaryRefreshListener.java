package com.carbonledger.aggregation.job;

import com.carbonledger.aggregation.EmissionAggregationService;
import com.carbonledger.aggregation.config.AggregationProperties;
import com.carbonledger.config.AsyncConfig;
import com.carbonledger.domain.EmissionResultsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Re-aggregates daily summaries of each affected date and monthly summaries of each affected month after
 * results change. Runs on the single-threaded aggregation executor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SummaryRefreshListener {

    private final EmissionAggregationService emissionAggregationService;
    private final AggregationProperties aggregationProperties;

    @EventListener
    @Async(AsyncConfig.AGGREGATION_EXECUTOR)
    public void onResultsChanged(EmissionResultsChangedEvent event) {
        if (!aggregationProperties.isRefreshOnChange()) {
            return;
        }
        SortedSet<LocalDate> days = new TreeSet<>(event.affectedDates());
        SortedSet<YearMonth> months = new TreeSet<>();
        for (LocalDate day : days) {
            emissionAggregationService.refreshDaily(day);
            months.add(YearMonth.from(day));
        }
        for (YearMonth month : months) {
            emissionAggregationService.refreshMonthly(month);
        }
        log.info("Refreshed summaries for {} day(s) and {} month(s)", days.size(), months.size());
    }
}
