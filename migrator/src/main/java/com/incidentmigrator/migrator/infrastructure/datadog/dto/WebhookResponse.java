package com.incidentmigrator.migrator.infrastructure.datadog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WebhookResponse(
        String name,
        String url,
        String payload,
        @JsonProperty("custom_headers") String customHeaders,
        @JsonProperty("encode_as") String encodeAs) {}
