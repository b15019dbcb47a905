package com.incidentmigrator.migrator.infrastructure.datadog;

import com.incidentmigrator.migrator.domain.exceptions.ApiException;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResource;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResourceGateway;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.WebhookResponse;
import com.incidentmigrator.migrator.infrastructure.datadog.mapper.DatadogMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;
import java.util.Optional;

/**
 * Webhooks integration API v1 adapter.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatadogWebhookClient implements DestinationResourceGateway {

    static final String WEBHOOKS_PATH = "/api/v1/integration/webhooks/configuration/webhooks";

    private final RestClient datadogRestClient;
    private final JsonMapper jsonMapper;
    private final DatadogMapper mapper;

    @Override
    public Optional<DestinationResource> findByName(String name) {
        var action = "get webhook " + name;
        try {
            var body = datadogRestClient.get()
                    .uri(WEBHOOKS_PATH + "/{name}", name)
                    .retrieve()
                    .body(String.class);
            return Optional.of(mapper.toDomain(jsonMapper.readValue(body, WebhookResponse.class)));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Webhook {} not found", name);
            return Optional.empty();
        } catch (RestClientResponseException e) {
            throw ApiException.of(action, DatadogMonitorClient.remoteError(e), e);
        } catch (RestClientException | JacksonException e) {
            throw ApiException.of(action, e.getMessage(), e);
        }
    }

    @Override
    public void create(DestinationResource resource) {
        var action = "create webhook " + resource.name();
        try {
            var request = mapper.toRequest(resource).toBuilder()
                    .customHeaders(customHeaders(resource.authToken()))
                    .build();
            datadogRestClient.post()
                    .uri(WEBHOOKS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(jsonMapper.writeValueAsString(request))
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Webhook {} created", resource.name());
        } catch (RestClientResponseException e) {
            throw ApiException.of(action, DatadogMonitorClient.remoteError(e), e);
        } catch (RestClientException | JacksonException e) {
            throw ApiException.of(action, e.getMessage(), e);
        }
    }

    /**
     * A token that is already a JSON header object is sent as is; anything else becomes a bearer header.
     */
    String customHeaders(String authToken) {
        if (authToken == null || authToken.isBlank()) {
            return null;
        }
        if (authToken.startsWith("{")) {
            return authToken;
        }
        return jsonMapper.writer()
                .without(SerializationFeature.INDENT_OUTPUT)
                .writeValueAsString(Map.of("Authorization", "Bearer " + authToken));
    }
}
