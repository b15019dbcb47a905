package com.incidentmigrator.migrator.application.config;

import com.incidentmigrator.migrator.domain.reconciliation.Operation;

import java.util.Optional;

/**
 * What one invocation of the migrator does. Bound from {@code migrator.operation}, e.g. {@code add-destination}.
 */
public enum MigratorCommand {
    ADD_DESTINATION(Operation.ADD_DESTINATION),
    REMOVE_DESTINATION(Operation.REMOVE_DESTINATION),
    REMOVE_PROVIDER(Operation.REMOVE_PROVIDER),
    ANALYZE(null),
    GENERATE_MAPPINGS(null);

    private final Operation operation;

    MigratorCommand(Operation operation) {
        this.operation = operation;
    }

    /**
     * The reconciliation this command runs; empty for the read-only and mapping commands.
     */
    public Optional<Operation> operation() {
        return Optional.ofNullable(operation);
    }
}
