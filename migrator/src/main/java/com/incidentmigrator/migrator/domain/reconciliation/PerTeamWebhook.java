package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.common.marker.Provider;
import lombok.Builder;

@Builder(toBuilder = true)
public record PerTeamWebhook(
        Provider provider,
        String url,
        String authToken
) implements DestinationConfig {

    public PerTeamWebhook {
        provider = provider == null ? Provider.PAGERDUTY : provider;
    }

    @Override
    public boolean requiresTeamIdentity() {
        return true;
    }

    @Override
    public String teamIdentityContext() {
        return "When using team-specific webhooks";
    }
}
