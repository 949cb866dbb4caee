package com.carbonledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Summary refresh after result changes runs off the calculation thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String AGGREGATION_EXECUTOR = "aggregation-executor";

    /** Single worker so refreshes of the same summary keys never interleave. */
    @Bean(name = AGGREGATION_EXECUTOR)
    public Executor aggregationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("aggregation-");
        e.initialize();
        return e;
    }
}
