package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.common.marker.Provider;
import com.incidentmigrator.migrator.domain.mapping.MappingTable;
import com.incidentmigrator.migrator.domain.mapping.MappingValidator;
import com.incidentmigrator.migrator.domain.mapping.ServiceMapping;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinitionRepository;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResource;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResourceGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@ExtendWith(MockitoExtension.class)
public abstract class ReconciliationEngineBaseTest {

    static final String WEBHOOK_URL = "https://api.incident.io/v2/alert_events/http/01HXYZ";
    static final String WEBHOOK_TOKEN = "secret-token";

    @Mock
    AlertDefinitionRepository alertRepository;

    @Mock
    DestinationResourceGateway resourceGateway;

    SimpleMeterRegistry registry;

    ReconciliationEngine engine;

    @BeforeEach
    void setUpEngine() {
        registry = new SimpleMeterRegistry();
        engine = new ReconciliationEngine(
                alertRepository,
                resourceGateway,
                new MappingValidator(),
                registry.counter("migrator.alerts.updated"),
                registry.counter("migrator.alerts.update.failed"),
                registry.counter("migrator.webhooks.created"));
    }

    static AlertDefinition alert(long id, String message, String... tags) {
        return AlertDefinition.builder()
                .id(id)
                .name("Monitor " + id)
                .message(message)
                .tags(new LinkedHashSet<>(List.of(tags)))
                .build();
    }

    static ServiceMapping mapping(String service, String team) {
        return mapping(service, team, Map.of());
    }

    static ServiceMapping mapping(String service, String team, Map<String, String> metadata) {
        return ServiceMapping.builder()
                .provider(Provider.PAGERDUTY)
                .sourceServiceKey(service)
                .destinationTeam(team)
                .metadata(metadata)
                .build();
    }

    static MigrationSettings singleWebhook(boolean annotateTeamTags, ServiceMapping... mappings) {
        var destination = SingleWebhook.builder()
                .provider(Provider.PAGERDUTY)
                .url(WEBHOOK_URL)
                .authToken(WEBHOOK_TOKEN)
                .annotateTeamTags(annotateTeamTags)
                .build();
        return new MigrationSettings(destination, new MappingTable(Provider.PAGERDUTY, List.of(mappings)));
    }

    static MigrationSettings perTeamWebhooks(ServiceMapping... mappings) {
        var destination = PerTeamWebhook.builder()
                .provider(Provider.PAGERDUTY)
                .url(WEBHOOK_URL)
                .authToken(WEBHOOK_TOKEN)
                .build();
        return new MigrationSettings(destination, new MappingTable(Provider.PAGERDUTY, List.of(mappings)));
    }

    static ReconciliationOptions live() {
        return ReconciliationOptions.builder().simulate(false).verbose(false).build();
    }

    static ReconciliationOptions dryRun() {
        return ReconciliationOptions.builder().simulate(true).verbose(true).build();
    }

    static DestinationResource webhook(String name) {
        return DestinationResource.builder().name(name).url(WEBHOOK_URL).build();
    }

    double counted(String name) {
        return registry.counter(name).count();
    }
}
