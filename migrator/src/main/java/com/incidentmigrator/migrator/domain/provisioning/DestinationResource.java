package com.incidentmigrator.migrator.domain.provisioning;

import lombok.Builder;

/**
 * Webhook integration on the monitoring platform that forwards alerts to incident.io.
 */
@Builder(toBuilder = true)
public record DestinationResource(
        String name,
        String url,
        String payloadTemplate,
        String authToken
) {
}
