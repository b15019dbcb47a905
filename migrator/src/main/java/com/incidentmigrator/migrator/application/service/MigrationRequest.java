package com.incidentmigrator.migrator.application.service;

import com.incidentmigrator.migrator.domain.monitor.AlertFilter;
import lombok.Builder;

import java.nio.file.Path;

/**
 * One invocation's inputs, independent of how they were supplied.
 *
 * @param fallbackAuthToken webhook token used when the config document has none
 */
@Builder
public record MigrationRequest(
        Path configFile,
        boolean dryRun,
        boolean verbose,
        AlertFilter filter,
        String fallbackAuthToken) {

    public MigrationRequest {
        filter = filter == null ? AlertFilter.none() : filter;
    }
}
