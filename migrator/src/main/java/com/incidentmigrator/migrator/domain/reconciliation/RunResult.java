package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.migrator.domain.mapping.ValidationReport;
import lombok.Builder;

import java.util.List;

/**
 * Aggregate of one reconciliation run. {@code validation} is only set for {@link Operation#ADD_DESTINATION}.
 */
@Builder
public record RunResult(
        Operation operation,
        boolean simulated,
        int processed,
        int updated,
        int unchanged,
        List<ChangeRecord> changes,
        List<RunError> errors,
        ValidationReport validation
) {

    public RunResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
