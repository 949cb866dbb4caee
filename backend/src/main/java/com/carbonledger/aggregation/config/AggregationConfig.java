package com.carbonledger.aggregation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Aggregation module configuration: binds AggregationProperties.
 */
@Configuration
@EnableConfigurationProperties(AggregationProperties.class)
public class AggregationConfig {
}
