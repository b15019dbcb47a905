package com.incidentmigrator.migrator.domain.reconciliation;

public enum Operation {
    ADD_DESTINATION,
    REMOVE_DESTINATION,
    REMOVE_PROVIDER
}
