package com.incidentmigrator.common.marker;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;

/**
 * Legacy paging providers whose service mentions can appear in a monitor message.
 */
@Getter
@RequiredArgsConstructor
public enum Provider {
    PAGERDUTY("pagerduty", "PagerDuty"),
    OPSGENIE("opsgenie", "Opsgenie");

    private final String literal;
    private final String displayName;

    /**
     * Resolves the {@code source} value of the migration config. A blank value means PagerDuty.
     *
     * @throws IllegalArgumentException if the value names neither provider
     */
    public static Provider fromSource(String source) {
        if (source == null || source.isBlank()) {
            return PAGERDUTY;
        }
        var normalized = source.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.literal.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider source: " + source));
    }
}
