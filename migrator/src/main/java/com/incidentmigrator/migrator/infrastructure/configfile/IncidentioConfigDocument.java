package com.incidentmigrator.migrator.infrastructure.configfile;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IncidentioConfigDocument(
        Boolean webhookPerTeam,
        String webhookUrl,
        String webhookToken,
        Boolean addTeamTags,
        String teamTagPrefix,
        String source) {

    public static IncidentioConfigDocument defaults() {
        return new IncidentioConfigDocument(false, null, null, false, "team", null);
    }
}
