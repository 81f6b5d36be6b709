package com.example.scenebrain_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the orchestration-core configuration properties.
 */
@Configuration
@EnableConfigurationProperties({ContextProperties.class, ScoringProperties.class, LearnerProperties.class})
public class AppPropertiesConfig {
}
