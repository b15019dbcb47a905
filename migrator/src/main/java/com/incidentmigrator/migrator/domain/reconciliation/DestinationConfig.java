package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.common.marker.Provider;

/**
 * How monitors are pointed at incident.io: one shared webhook, or one webhook per team.
 */
public sealed interface DestinationConfig permits SingleWebhook, PerTeamWebhook {

    Provider provider();

    String url();

    String authToken();

    /**
     * Whether every referenced service needs a well-formed team assignment.
     */
    boolean requiresTeamIdentity();

    /**
     * Phrase naming the setting that makes team identity required, used in error messages.
     */
    String teamIdentityContext();
}
