package com.carbonledger.aggregation.job;

import com.carbonledger.aggregation.EmissionAggregationService;
import com.carbonledger.aggregation.config.AggregationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Nightly daily aggregation of the previous UTC day. Disabled unless carbonledger.aggregation.daily.enabled=true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailyAggregationJob {

    private final EmissionAggregationService emissionAggregationService;
    private final AggregationProperties aggregationProperties;

    @Scheduled(cron = "${carbonledger.aggregation.daily.cron:0 15 0 * * *}", zone = "UTC")
    public void runScheduled() {
        if (!aggregationProperties.getDaily().isEnabled()) {
            return;
        }
        LocalDate yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1);
        int written = emissionAggregationService.aggregateDaily(yesterday).size();
        log.info("Daily aggregation for {} wrote {} summaries", yesterday, written);
    }
}
