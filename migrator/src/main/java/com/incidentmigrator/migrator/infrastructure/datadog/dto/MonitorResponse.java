package com.incidentmigrator.migrator.infrastructure.datadog.dto;

import java.util.List;

public record MonitorResponse(long id, String name, String message, List<String> tags) {}
