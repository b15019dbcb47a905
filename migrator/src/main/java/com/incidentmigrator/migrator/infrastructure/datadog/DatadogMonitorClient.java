package com.incidentmigrator.migrator.infrastructure.datadog;

import com.incidentmigrator.migrator.domain.exceptions.ApiException;
import com.incidentmigrator.migrator.domain.exceptions.ConnectivityException;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinitionRepository;
import com.incidentmigrator.migrator.domain.monitor.AlertUpdate;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.MonitorResponse;
import com.incidentmigrator.migrator.infrastructure.datadog.mapper.DatadogMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Repository;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.util.Arrays;
import java.util.List;

/**
 * Monitors API v1 adapter.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DatadogMonitorClient implements AlertDefinitionRepository {

    static final String MONITORS_PATH = "/api/v1/monitor";

    private final RestClient datadogRestClient;
    private final JsonMapper jsonMapper;
    private final DatadogMapper mapper;

    @Override
    public List<AlertDefinition> findAll() {
        try {
            var body = datadogRestClient.get()
                    .uri(uriBuilder -> uriBuilder.path(MONITORS_PATH).queryParam("group_states", "all").build())
                    .retrieve()
                    .body(String.class);
            var monitors = body == null || body.isBlank()
                    ? new MonitorResponse[0]
                    : jsonMapper.readValue(body, MonitorResponse[].class);
            log.info("Fetched {} monitors", monitors.length);
            return mapper.toDomain(Arrays.asList(monitors));
        } catch (RestClientException | JacksonException e) {
            throw ConnectivityException.monitorsUnavailable(e);
        }
    }

    @Override
    public AlertDefinition update(long id, AlertUpdate update) {
        var action = "update monitor " + id;
        try {
            var body = datadogRestClient.put()
                    .uri(MONITORS_PATH + "/{id}", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(jsonMapper.writeValueAsString(mapper.toRequest(update)))
                    .retrieve()
                    .body(String.class);
            log.debug("Monitor {} updated", id);
            return mapper.toDomain(jsonMapper.readValue(body, MonitorResponse.class));
        } catch (RestClientResponseException e) {
            throw ApiException.of(action, remoteError(e), e);
        } catch (RestClientException | JacksonException e) {
            throw ApiException.of(action, e.getMessage(), e);
        }
    }

    static String remoteError(RestClientResponseException e) {
        var body = e.getResponseBodyAsString();
        return body.isBlank() ? e.getStatusCode() + " " + e.getStatusText() : body;
    }
}
