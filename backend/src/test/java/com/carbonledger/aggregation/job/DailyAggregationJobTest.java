package com.carbonledger.aggregation.job;

import com.carbonledger.aggregation.EmissionAggregationService;
import com.carbonledger.aggregation.config.AggregationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DailyAggregationJobTest {

    @Mock
    EmissionAggregationService emissionAggregationService;

    private AggregationProperties properties;
    private DailyAggregationJob job;

    @BeforeEach
    void setUp() {
        properties = new AggregationProperties();
        job = new DailyAggregationJob(emissionAggregationService, properties);
    }

    @Test
    void skippedWhenDisabled() {
        job.runScheduled();

        verifyNoInteractions(emissionAggregationService);
    }

    @Test
    void aggregatesPreviousUtcDay() {
        properties.getDaily().setEnabled(true);
        LocalDate yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1);

        job.runScheduled();

        verify(emissionAggregationService).aggregateDaily(yesterday);
    }
}
