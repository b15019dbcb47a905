package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.migrator.domain.mapping.ServiceMapping;

import java.nio.file.Path;
import java.util.List;

public interface MigrationSettingsStore {

    /**
     * @param fallbackAuthToken used when the document carries no webhook token; may be null
     * @throws com.incidentmigrator.migrator.domain.exceptions.ConfigurationException if the document is
     *                                                                                missing or malformed
     */
    MigrationSettings load(Path configFile, String fallbackAuthToken);

    /**
     * Like {@link #load}, but first writes a default document when none exists.
     */
    MigrationSettings loadOrCreate(Path configFile, String fallbackAuthToken);

    /**
     * Replaces the mapping list of the document, leaving the other settings untouched.
     */
    void saveMappings(Path configFile, List<ServiceMapping> mappings);
}
