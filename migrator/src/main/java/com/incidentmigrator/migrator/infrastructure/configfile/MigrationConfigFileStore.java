package com.incidentmigrator.migrator.infrastructure.configfile;

import com.incidentmigrator.common.marker.Provider;
import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.mapping.MappingTable;
import com.incidentmigrator.migrator.domain.mapping.ServiceMapping;
import com.incidentmigrator.migrator.domain.reconciliation.DestinationConfig;
import com.incidentmigrator.migrator.domain.reconciliation.MigrationSettings;
import com.incidentmigrator.migrator.domain.reconciliation.MigrationSettingsStore;
import com.incidentmigrator.migrator.domain.reconciliation.PerTeamWebhook;
import com.incidentmigrator.migrator.domain.reconciliation.SingleWebhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the JSON migration config document.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MigrationConfigFileStore implements MigrationSettingsStore {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JsonMapper jsonMapper;

    @Override
    public MigrationSettings load(Path configFile, String fallbackAuthToken) {
        if (!Files.exists(configFile)) {
            throw ConfigurationException.unreadableFile(configFile.toString(),
                    new IOException("Config file not found: " + configFile.toAbsolutePath()));
        }
        var document = read(configFile);
        var settings = toSettings(document, fallbackAuthToken);
        log.info("Loaded {} mappings from {}", settings.mappings().mappings().size(), configFile);
        return settings;
    }

    @Override
    public MigrationSettings loadOrCreate(Path configFile, String fallbackAuthToken) {
        if (!Files.exists(configFile)) {
            write(configFile, jsonMapper.valueToTree(
                    new MigrationConfigDocument(IncidentioConfigDocument.defaults(), List.of())));
            log.info("Created new config file at {}", configFile);
        }
        return load(configFile, fallbackAuthToken);
    }

    @Override
    public void saveMappings(Path configFile, List<ServiceMapping> mappings) {
        ObjectNode root;
        if (Files.exists(configFile)) {
            var tree = readTree(configFile);
            if (!(tree instanceof ObjectNode objectNode)) {
                throw ConfigurationException.invalidValue("config document", "expected a JSON object");
            }
            root = objectNode;
        } else {
            root = jsonMapper.valueToTree(new MigrationConfigDocument(IncidentioConfigDocument.defaults(), null));
        }
        var documents = mappings.stream().map(MigrationConfigFileStore::toDocument).toList();
        root.set("mappings", jsonMapper.valueToTree(documents));
        write(configFile, root);
        log.info("Wrote {} mappings to {}", mappings.size(), configFile);
    }

    private MigrationConfigDocument read(Path configFile) {
        try {
            return jsonMapper.readValue(Files.readString(configFile), MigrationConfigDocument.class);
        } catch (IOException | JacksonException e) {
            throw ConfigurationException.unreadableFile(configFile.toString(), e);
        }
    }

    private JsonNode readTree(Path configFile) {
        try {
            return jsonMapper.readTree(Files.readString(configFile));
        } catch (IOException | JacksonException e) {
            throw ConfigurationException.unreadableFile(configFile.toString(), e);
        }
    }

    private void write(Path configFile, Object tree) {
        try {
            Files.writeString(configFile, jsonMapper.writeValueAsString(tree));
        } catch (IOException | JacksonException e) {
            throw ConfigurationException.unwritableFile(configFile.toString(), e);
        }
    }

    private MigrationSettings toSettings(MigrationConfigDocument document, String fallbackAuthToken) {
        var incidentio = document.incidentioConfig();
        var provider = provider(incidentio.source());

        var token = normalizeToken(incidentio.webhookToken());
        if (token == null) {
            token = normalizeToken(fallbackAuthToken);
        }

        DestinationConfig destination = Boolean.TRUE.equals(incidentio.webhookPerTeam())
                ? PerTeamWebhook.builder()
                        .provider(provider)
                        .url(incidentio.webhookUrl())
                        .authToken(token)
                        .build()
                : SingleWebhook.builder()
                        .provider(provider)
                        .url(incidentio.webhookUrl())
                        .authToken(token)
                        .annotateTeamTags(Boolean.TRUE.equals(incidentio.addTeamTags()))
                        .tagPrefix(incidentio.teamTagPrefix())
                        .build();

        var mappings = new ArrayList<ServiceMapping>();
        for (var entry : document.mappings()) {
            var mapping = toDomain(entry);
            if (mapping == null) {
                log.warn("Ignoring mapping without pagerdutyService or opsgenieService: team {}",
                        entry.incidentioTeam());
                continue;
            }
            mappings.add(mapping);
        }
        return new MigrationSettings(destination, new MappingTable(provider, mappings));
    }

    private static Provider provider(String source) {
        try {
            return Provider.fromSource(source);
        } catch (IllegalArgumentException e) {
            throw ConfigurationException.invalidValue("incidentioConfig.source", source);
        }
    }

    /**
     * Accepts a bare token, {@code Bearer <token>}, or {@code {"Authorization": "Bearer <token>"}}.
     * Returns null for a blank token.
     */
    String normalizeToken(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        var token = raw.trim();
        if (token.startsWith("{") && token.contains("Authorization")) {
            try {
                var header = jsonMapper.readValue(token, AuthorizationHeader.class);
                if (header.authorization() != null) {
                    token = header.authorization().trim();
                }
            } catch (JacksonException e) {
                log.warn("Webhook token looks like a header object but is not valid JSON; using it as is");
            }
        }
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length()).trim();
        }
        return token.isEmpty() ? null : token;
    }

    private static ServiceMapping toDomain(MappingDocument document) {
        Provider provider;
        String key;
        if (document.pagerdutyService() != null) {
            provider = Provider.PAGERDUTY;
            key = document.pagerdutyService();
        } else if (document.opsgenieService() != null) {
            provider = Provider.OPSGENIE;
            key = document.opsgenieService();
        } else {
            return null;
        }
        return ServiceMapping.builder()
                .provider(provider)
                .sourceServiceKey(key)
                .destinationTeam(document.incidentioTeam())
                .metadata(document.additionalMetadata())
                .build();
    }

    private static MappingDocument toDocument(ServiceMapping mapping) {
        var metadata = mapping.metadata().isEmpty() ? null : mapping.metadata();
        return mapping.provider() == Provider.OPSGENIE
                ? new MappingDocument(null, mapping.sourceServiceKey(), mapping.destinationTeam(), metadata)
                : new MappingDocument(mapping.sourceServiceKey(), null, mapping.destinationTeam(), metadata);
    }
}
