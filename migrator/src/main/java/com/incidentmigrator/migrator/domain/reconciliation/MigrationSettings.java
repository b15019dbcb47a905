package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.migrator.domain.mapping.MappingTable;

/**
 * Everything one run reads from the migration config document.
 */
public record MigrationSettings(DestinationConfig destination, MappingTable mappings) {
}
