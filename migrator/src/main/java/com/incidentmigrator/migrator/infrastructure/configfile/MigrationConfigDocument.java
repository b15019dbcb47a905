package com.incidentmigrator.migrator.infrastructure.configfile;

import java.util.List;

public record MigrationConfigDocument(IncidentioConfigDocument incidentioConfig, List<MappingDocument> mappings) {

    public MigrationConfigDocument {
        incidentioConfig = incidentioConfig == null ? IncidentioConfigDocument.defaults() : incidentioConfig;
        mappings = mappings == null ? List.of() : mappings;
    }
}
