package com.incidentmigrator.migrator.infrastructure.datadog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookRequest(
        String name,
        String url,
        String payload,
        @JsonProperty("custom_headers") String customHeaders,
        @JsonProperty("encode_as") String encodeAs) {}
