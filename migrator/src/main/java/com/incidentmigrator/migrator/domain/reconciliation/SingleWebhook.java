package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.common.marker.Provider;
import lombok.Builder;

@Builder(toBuilder = true)
public record SingleWebhook(
        Provider provider,
        String url,
        String authToken,
        boolean annotateTeamTags,
        String tagPrefix
) implements DestinationConfig {

    public static final String DEFAULT_TAG_PREFIX = "team";

    public SingleWebhook {
        provider = provider == null ? Provider.PAGERDUTY : provider;
        tagPrefix = tagPrefix == null || tagPrefix.isBlank() ? DEFAULT_TAG_PREFIX : tagPrefix;
    }

    @Override
    public boolean requiresTeamIdentity() {
        return annotateTeamTags;
    }

    @Override
    public String teamIdentityContext() {
        return "When adding team tags based on mappings";
    }

    public String teamTag(String team) {
        return tagPrefix + ":" + team;
    }
}
