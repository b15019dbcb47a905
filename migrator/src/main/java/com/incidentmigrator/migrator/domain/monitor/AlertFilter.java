package com.incidentmigrator.migrator.domain.monitor;

import lombok.Builder;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Pre-filter applied before reconciliation. A monitor passes when it carries any of the listed tags
 * and its name and message match the (case-insensitive) patterns. Absent criteria always pass.
 */
@Builder
public record AlertFilter(
        List<String> tags,
        String namePattern,
        String messagePattern
) {

    public AlertFilter {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static AlertFilter none() {
        return AlertFilter.builder().build();
    }

    public boolean isEmpty() {
        return tags.isEmpty() && isBlank(namePattern) && isBlank(messagePattern);
    }

    public List<AlertDefinition> apply(List<AlertDefinition> alerts) {
        if (isEmpty()) {
            return alerts;
        }
        var name = compile(namePattern);
        var message = compile(messagePattern);
        return alerts.stream()
                .filter(alert -> tags.isEmpty() || tags.stream().anyMatch(alert.tags()::contains))
                .filter(alert -> name == null || name.matcher(alert.name() == null ? "" : alert.name()).find())
                .filter(alert -> message == null || message.matcher(alert.message()).find())
                .toList();
    }

    private static Pattern compile(String pattern) {
        return isBlank(pattern) ? null : Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
