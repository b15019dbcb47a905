package com.incidentmigrator.migrator.domain.provisioning;

import com.incidentmigrator.migrator.domain.exceptions.ApiException;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Makes sure a webhook exists before a monitor references it. One instance serves one run and
 * remembers the outcome per name, so each distinct name costs at most one lookup and one creation
 * attempt however many monitors reference it.
 *
 * <p>Failures are returned, never thrown, so the caller can skip just the affected monitor.
 * Not thread-safe; runs are sequential.
 */
@Slf4j
public class ResourceProvisioner {

    private final DestinationResourceGateway gateway;
    private final String url;
    private final String authToken;
    private final boolean simulate;
    private final Counter webhooksCreatedCounter;
    private final Map<String, ProvisioningResult> outcomes = new LinkedHashMap<>();

    public ResourceProvisioner(DestinationResourceGateway gateway, String url, String authToken, boolean simulate,
                               Counter webhooksCreatedCounter) {
        this.gateway = gateway;
        this.url = url;
        this.authToken = authToken;
        this.simulate = simulate;
        this.webhooksCreatedCounter = webhooksCreatedCounter;
    }

    /**
     * @param team     embedded as a {@code team} payload field when non-null
     * @param metadata embedded as one payload field per entry
     */
    public ProvisioningResult ensureExists(String resourceName, String team, Map<String, String> metadata) {
        if (simulate) {
            log.debug("Dry run: skipping webhook provisioning for {}", resourceName);
            return ProvisioningResult.available(resourceName);
        }
        var known = outcomes.get(resourceName);
        if (known != null) {
            return known;
        }
        var result = provision(resourceName, team, metadata);
        outcomes.put(resourceName, result);
        return result;
    }

    private ProvisioningResult provision(String resourceName, String team, Map<String, String> metadata) {
        try {
            if (gateway.findByName(resourceName).isPresent()) {
                log.debug("Webhook {} already exists", resourceName);
                return ProvisioningResult.available(resourceName);
            }
        } catch (ApiException e) {
            log.warn("Could not look up webhook {}: {}", resourceName, e.getMessage());
            return ProvisioningResult.failed(resourceName, e.getMessage());
        }

        if (isBlank(url) || isBlank(authToken)) {
            log.warn("Cannot create webhook {}: incident.io webhook URL or token is not configured "
                    + "(set incidentioConfig.webhookToken or INCIDENTIO_WEBHOOK_TOKEN)", resourceName);
            return ProvisioningResult.failed(resourceName, "missing incident.io webhook URL or token");
        }

        var resource = DestinationResource.builder()
                .name(resourceName)
                .url(url)
                .payloadTemplate(PayloadTemplate.render(team, metadata))
                .authToken(authToken)
                .build();
        try {
            gateway.create(resource);
        } catch (ApiException e) {
            log.warn("Failed to create webhook {}: {}", resourceName, e.getMessage());
            return ProvisioningResult.failed(resourceName, e.getMessage());
        }

        webhooksCreatedCounter.increment();
        log.info("Created webhook {}", resourceName);
        return ProvisioningResult.available(resourceName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
