package com.scholary.intervals.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for interval merging beans.
 *
 * <p>Enables the IntervalMergeProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(IntervalMergeProperties.class)
public class IntervalMergeConfig {}
