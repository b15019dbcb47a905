package com.incidentmigrator.migrator.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Counter alertsUpdatedCounter(MeterRegistry registry) {
        return Counter.builder("migrator.alerts.updated")
                .description("Monitors updated on the alerting platform")
                .register(registry);
    }

    @Bean
    public Counter alertUpdateFailuresCounter(MeterRegistry registry) {
        return Counter.builder("migrator.alerts.update.failed")
                .description("Monitor updates rejected by the alerting platform")
                .register(registry);
    }

    @Bean
    public Counter webhooksCreatedCounter(MeterRegistry registry) {
        return Counter.builder("migrator.webhooks.created")
                .description("incident.io webhooks created")
                .register(registry);
    }
}
