package com.carbonledger.aggregation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Aggregation module configuration. Documented in application.yml under carbonledger.aggregation.
 */
@ConfigurationProperties(prefix = "carbonledger.aggregation")
@Getter
@Setter
public class AggregationProperties {

    /**
     * Re-aggregate daily and monthly summaries for the affected dates whenever results change.
     */
    private boolean refreshOnChange = true;

    private DailyProperties daily = new DailyProperties();

    @Getter
    @Setter
    public static class DailyProperties {
        /** Run the nightly aggregation of the previous UTC day. */
        private boolean enabled = false;
        /** Spring cron expression, evaluated in UTC. */
        private String cron = "0 15 0 * * *";
    }
}
