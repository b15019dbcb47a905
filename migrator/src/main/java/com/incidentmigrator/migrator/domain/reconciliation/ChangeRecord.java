package com.incidentmigrator.migrator.domain.reconciliation;

import lombok.Builder;

import java.util.Set;

@Builder
public record ChangeRecord(
        long id,
        String name,
        OutcomeStatus status,
        String before,
        String after,
        Set<String> tagsBefore,
        Set<String> tagsAfter,
        String reason
) {

    public boolean messageChanged() {
        return before != null && !before.equals(after);
    }
}
