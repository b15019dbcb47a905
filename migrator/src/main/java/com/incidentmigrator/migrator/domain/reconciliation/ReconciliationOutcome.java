package com.incidentmigrator.migrator.domain.reconciliation;

import lombok.Builder;

import java.util.Set;

/**
 * Result for one monitor. {@code newTags} is null when the tags are not changed.
 */
@Builder(toBuilder = true)
public record ReconciliationOutcome(
        long alertId,
        OutcomeStatus status,
        String newMessage,
        Set<String> newTags,
        String reason,
        String error
) {

    public boolean updated() {
        return status == OutcomeStatus.UPDATED;
    }

    static ReconciliationOutcome updated(long alertId, String newMessage, Set<String> newTags) {
        return ReconciliationOutcome.builder()
                .alertId(alertId)
                .status(OutcomeStatus.UPDATED)
                .newMessage(newMessage)
                .newTags(newTags)
                .build();
    }

    static ReconciliationOutcome unchanged(long alertId, String message, String reason) {
        return ReconciliationOutcome.builder()
                .alertId(alertId)
                .status(OutcomeStatus.UNCHANGED)
                .newMessage(message)
                .reason(reason)
                .build();
    }

    static ReconciliationOutcome skipped(long alertId, String message, String reason) {
        return ReconciliationOutcome.builder()
                .alertId(alertId)
                .status(OutcomeStatus.SKIPPED)
                .newMessage(message)
                .reason(reason)
                .build();
    }
}
