package com.purchasingpower.cora.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the application's {@code @ConfigurationProperties} classes:
 * <ul>
 *   <li>{@link AppProperties} - chunking, ranking, budget, store, model and indexing settings
 *   <li>{@link GlobalRetryConfig} - retry and backoff for store and embedding calls
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    AppProperties.class,
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
