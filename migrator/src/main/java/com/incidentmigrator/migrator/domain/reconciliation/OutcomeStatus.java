package com.incidentmigrator.migrator.domain.reconciliation;

public enum OutcomeStatus {
    /** Change applied, or computed in a dry run. */
    UPDATED,
    /** Already in the target state, or nothing to act on. */
    UNCHANGED,
    /** A required webhook could not be provisioned. */
    SKIPPED,
    /** Change computed but the platform rejected the update. */
    UPDATE_FAILED
}
