package com.incidentmigrator.migrator.domain.monitor;

import java.util.Set;

/**
 * Fields to change on a monitor. {@code tags} is null when the tags are left alone.
 */
public record AlertUpdate(String message, Set<String> tags) {
}
