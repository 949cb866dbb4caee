package com.carbonledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * One scheduler thread per job (PendingCalculationJob, DailyAggregationJob), so a long streaming sweep never
 * holds back the nightly aggregation. On shutdown a running sweep gets time to finish its current page.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String JOB_SCHEDULER = "job-scheduler";

    static final int SCHEDULED_JOBS = 2;
    static final int SHUTDOWN_AWAIT_SECONDS = 30;

    @Bean(name = JOB_SCHEDULER)
    public ThreadPoolTaskScheduler jobScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(SCHEDULED_JOBS);
        s.setThreadNamePrefix("job-scheduler-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        s.initialize();
        return s;
    }
}
