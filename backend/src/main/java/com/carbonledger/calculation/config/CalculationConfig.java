package com.carbonledger.calculation.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Calculation module configuration: binds CalculationProperties.
 */
@Configuration
@EnableConfigurationProperties(CalculationProperties.class)
public class CalculationConfig {
}
