package com.optionanalytics.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. Applied as a registry customizer so the
 * counters {@link com.optionanalytics.observability.AnalyticsMetrics} registers at startup
 * carry it too.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:options-analytics}") String application) {
        return registry -> registry.config().commonTags("application", application);
    }
}
