package com.incidentmigrator.migrator.infrastructure.datadog.mapper;

import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import com.incidentmigrator.migrator.domain.monitor.AlertUpdate;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResource;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.MonitorResponse;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.MonitorUpdateRequest;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.WebhookRequest;
import com.incidentmigrator.migrator.infrastructure.datadog.dto.WebhookResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Mapper(componentModel = "spring")
public interface DatadogMapper {

    String JSON_ENCODING = "json";

    AlertDefinition toDomain(MonitorResponse response);

    List<AlertDefinition> toDomain(List<MonitorResponse> responses);

    MonitorUpdateRequest toRequest(AlertUpdate update);

    @Mapping(target = "payloadTemplate", source = "payload")
    @Mapping(target = "authToken", source = "customHeaders")
    DestinationResource toDomain(WebhookResponse response);

    /**
     * Headers are formatted by the client, which owns the JSON mapper.
     */
    @Mapping(target = "payload", source = "payloadTemplate")
    @Mapping(target = "customHeaders", ignore = true)
    @Mapping(target = "encodeAs", constant = JSON_ENCODING)
    WebhookRequest toRequest(DestinationResource resource);

    default Set<String> toTags(List<String> tags) {
        return tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
    }
}
