package com.incidentmigrator.migrator.domain.reconciliation;

public record RunError(long alertId, String error) {
}
