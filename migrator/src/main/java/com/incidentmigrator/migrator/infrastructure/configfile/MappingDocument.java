package com.incidentmigrator.migrator.infrastructure.configfile;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One entry of {@code mappings}. Exactly one of the service keys is expected; {@code incidentioTeam} is
 * always written so placeholders show up as {@code null} for the user to fill in.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MappingDocument(
        String pagerdutyService,
        String opsgenieService,
        @JsonInclude(JsonInclude.Include.ALWAYS) String incidentioTeam,
        Map<String, String> additionalMetadata) {}
