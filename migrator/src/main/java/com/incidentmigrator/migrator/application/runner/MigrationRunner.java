package com.incidentmigrator.migrator.application.runner;

import com.incidentmigrator.migrator.application.config.MigratorProperties;
import com.incidentmigrator.migrator.application.service.MigrationCommandHandler;
import com.incidentmigrator.migrator.application.service.MigrationRequest;
import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.monitor.AlertFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the configured {@code migrator.operation} once at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationRunner implements ApplicationRunner {

    private final MigratorProperties properties;
    private final MigrationCommandHandler commandHandler;
    private final RunReportLogger reportLogger;

    @Override
    public void run(ApplicationArguments args) {
        var command = properties.operation();
        if (command == null) {
            throw ConfigurationException.missingField("migrator.operation");
        }
        requireText(properties.configFile(), "migrator.config-file");
        requireText(properties.datadog().apiKey(), "migrator.datadog.api-key");
        requireText(properties.datadog().appKey(), "migrator.datadog.app-key");

        var request = toRequest();
        switch (command) {
            case ANALYZE -> reportLogger.report(commandHandler.analyze(request));
            case GENERATE_MAPPINGS -> reportLogger.report(commandHandler.generateMappings(request));
            default -> reportLogger.report(commandHandler.reconcile(command.operation().orElseThrow(), request));
        }
    }

    MigrationRequest toRequest() {
        var filter = properties.filter();
        return MigrationRequest.builder()
                .configFile(Path.of(properties.configFile()))
                .dryRun(properties.dryRun())
                .verbose(properties.verbose())
                .filter(AlertFilter.builder()
                        .tags(filter.tags())
                        .namePattern(filter.namePattern())
                        .messagePattern(filter.messagePattern())
                        .build())
                .fallbackAuthToken(properties.incidentio().webhookToken())
                .build();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ConfigurationException.missingField(field);
        }
    }
}
