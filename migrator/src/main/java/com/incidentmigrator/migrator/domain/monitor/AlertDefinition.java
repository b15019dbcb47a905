package com.incidentmigrator.migrator.domain.monitor;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Local, per-run copy of a monitor owned by the monitoring platform.
 */
@Builder(toBuilder = true)
public record AlertDefinition(
        long id,
        String name,
        String message,
        Set<String> tags
) {

    public AlertDefinition {
        message = message == null ? "" : message;
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }
}
