package com.incidentmigrator.migrator.domain.analysis;

import com.incidentmigrator.migrator.domain.mapping.ValidationReport;
import lombok.Builder;

import java.util.List;

/**
 * Read-only census of how monitors reference the legacy provider and incident.io.
 */
@Builder
public record AnalysisReport(
        int totalMonitors,
        int withProvider,
        int withDestination,
        int withBoth,
        int withNeither,
        List<Occurrence> providerServices,
        List<Occurrence> destinationMarkers,
        ValidationReport validation
) {

    public AnalysisReport {
        providerServices = providerServices == null ? List.of() : List.copyOf(providerServices);
        destinationMarkers = destinationMarkers == null ? List.of() : List.copyOf(destinationMarkers);
    }

    public record Occurrence(String name, int count) {}
}
