package com.incidentmigrator.migrator.infrastructure.datadog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Partial monitor update; a null field is left unchanged by the platform.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorUpdateRequest(String message, List<String> tags) {}
