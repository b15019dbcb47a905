package com.incidentmigrator.migrator.domain.mapping;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classification of every provider service referenced by the monitors under migration. Each service
 * is in exactly one of {@code mapped}, {@code unmapped} and {@code nullMapped}; {@code malformedTeamNames}
 * is a subset of {@code mapped}, filled only when team identity is required.
 */
@Builder
public record ValidationReport(
        Set<String> mapped,
        Set<String> unmapped,
        Set<String> nullMapped,
        Map<String, String> malformedTeamNames,
        boolean teamIdentityRequired
) {

    public ValidationReport {
        mapped = immutable(mapped);
        unmapped = immutable(unmapped);
        nullMapped = immutable(nullMapped);
        malformedTeamNames = malformedTeamNames == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(malformedTeamNames));
    }

    public boolean valid() {
        return unmapped.isEmpty()
                && (!teamIdentityRequired || nullMapped.isEmpty() && malformedTeamNames.isEmpty());
    }

    public List<String> malformedDescriptions() {
        return malformedTeamNames.entrySet().stream()
                .map(entry -> entry.getKey() + " → \"" + entry.getValue() + "\"")
                .toList();
    }

    private static Set<String> immutable(Set<String> values) {
        return values == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
