package com.incidentmigrator.migrator.infrastructure.configfile;

import com.incidentmigrator.common.json.JacksonConfig;
import com.incidentmigrator.common.marker.Provider;
import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.mapping.ServiceMapping;
import com.incidentmigrator.migrator.domain.reconciliation.PerTeamWebhook;
import com.incidentmigrator.migrator.domain.reconciliation.SingleWebhook;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationConfigFileStoreTest {

    private final MigrationConfigFileStore store = new MigrationConfigFileStore(JacksonConfig.createJsonMapper());

    @TempDir
    Path directory;

    private Path write(String json) throws IOException {
        var file = directory.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }

    @Nested
    class Load {

        @Test
        void shouldBuildSingleWebhookWithTeamTags() throws IOException {
            // given
            var file = write("""
                    {
                      "incidentioConfig": {
                        "webhookPerTeam": false,
                        "webhookUrl": "https://api.incident.io/hook",
                        "webhookToken": "Bearer abc123",
                        "addTeamTags": true,
                        "teamTagPrefix": "owner"
                      },
                      "mappings": [
                        {"pagerdutyService": "api", "incidentioTeam": "api-team",
                         "additionalMetadata": {"priority": "high"}},
                        {"pagerdutyService": "legacy", "incidentioTeam": null}
                      ]
                    }
                    """);

            // when
            var settings = store.load(file, null);

            // then
            assertThat(settings.destination()).isInstanceOfSatisfying(SingleWebhook.class, single -> {
                assertThat(single.provider()).isEqualTo(Provider.PAGERDUTY);
                assertThat(single.url()).isEqualTo("https://api.incident.io/hook");
                assertThat(single.authToken()).isEqualTo("abc123");
                assertThat(single.annotateTeamTags()).isTrue();
                assertThat(single.teamTag("api-team")).isEqualTo("owner:api-team");
            });
            assertThat(settings.mappings().teamFor("api")).contains("api-team");
            assertThat(settings.mappings().lookup("api").orElseThrow().metadata()).containsEntry("priority", "high");
            assertThat(settings.mappings().lookup("legacy")).isPresent();
            assertThat(settings.mappings().teamFor("legacy")).isEmpty();
        }

        @Test
        void shouldBuildPerTeamWebhookForOpsgenie() throws IOException {
            // given
            var file = write("""
                    {"incidentioConfig": {"webhookPerTeam": true, "source": "opsgenie"},
                     "mappings": [{"opsgenieService": "db", "incidentioTeam": "db-team"},
                                  {"pagerdutyService": "db", "incidentioTeam": "other-team"}]}
                    """);

            // when
            var settings = store.load(file, "env-token");

            // then
            assertThat(settings.destination()).isInstanceOf(PerTeamWebhook.class);
            assertThat(settings.destination().provider()).isEqualTo(Provider.OPSGENIE);
            assertThat(settings.destination().authToken()).isEqualTo("env-token");
            assertThat(settings.mappings().teamFor("db")).contains("db-team");
        }

        @Test
        void shouldApplyDefaultsForMissingSections() throws IOException {
            // given
            var file = write("{}");

            // when
            var settings = store.load(file, null);

            // then
            assertThat(settings.destination()).isInstanceOfSatisfying(SingleWebhook.class, single -> {
                assertThat(single.annotateTeamTags()).isFalse();
                assertThat(single.tagPrefix()).isEqualTo("team");
                assertThat(single.authToken()).isNull();
            });
            assertThat(settings.mappings().mappings()).isEmpty();
        }

        @Test
        void shouldRejectMissingFile() {
            assertThatThrownBy(() -> store.load(directory.resolve("missing.json"), null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Config file not found");
        }

        @Test
        void shouldRejectMalformedJson() throws IOException {
            // given
            var file = write("{ not json");

            // when / then
            assertThatThrownBy(() -> store.load(file, null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Failed to load config");
        }

        @Test
        void shouldRejectUnknownSource() throws IOException {
            // given
            var file = write("{\"incidentioConfig\": {\"source\": \"victorops\"}}");

            // when / then
            assertThatThrownBy(() -> store.load(file, null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessage("Invalid value for incidentioConfig.source: victorops");
        }
    }

    @Nested
    class NormalizeToken {

        @Test
        void shouldExtractTokenFromHeaderObject() {
            assertThat(store.normalizeToken("{\"Authorization\": \"Bearer xyz\"}")).isEqualTo("xyz");
        }

        @Test
        void shouldStripBearerPrefix() {
            assertThat(store.normalizeToken("  Bearer xyz ")).isEqualTo("xyz");
        }

        @Test
        void shouldKeepBareToken() {
            assertThat(store.normalizeToken("xyz")).isEqualTo("xyz");
        }

        @Test
        void shouldTreatBlankAsAbsent() {
            assertThat(store.normalizeToken("   ")).isNull();
            assertThat(store.normalizeToken(null)).isNull();
        }
    }

    @Nested
    class SaveMappings {

        @Test
        void shouldReplaceMappingsAndKeepOtherSettings() throws IOException {
            // given
            var file = write("""
                    {"incidentioConfig": {"webhookPerTeam": true, "webhookUrl": "https://hook"},
                     "mappings": []}
                    """);
            var mappings = List.of(
                    ServiceMapping.builder()
                            .provider(Provider.PAGERDUTY)
                            .sourceServiceKey("api")
                            .destinationTeam("api-team")
                            .metadata(Map.of("env", "prod"))
                            .build(),
                    ServiceMapping.builder().provider(Provider.PAGERDUTY).sourceServiceKey("new-svc").build());

            // when
            store.saveMappings(file, mappings);

            // then
            var written = Files.readString(file);
            assertThat(written).containsPattern("\"incidentioTeam\"\\s*:\\s*null");
            var reloaded = store.load(file, null);
            assertThat(reloaded.destination()).isInstanceOf(PerTeamWebhook.class);
            assertThat(reloaded.destination().url()).isEqualTo("https://hook");
            assertThat(reloaded.mappings().mappings()).containsExactlyElementsOf(mappings);
        }

        @Test
        void shouldCreateMissingDocumentWithDefaults() {
            // given
            var file = directory.resolve("new-config.json");

            // when
            var settings = store.loadOrCreate(file, null);

            // then
            assertThat(Files.exists(file)).isTrue();
            assertThat(settings.destination()).isInstanceOf(SingleWebhook.class);
            assertThat(settings.mappings().mappings()).isEmpty();
        }
    }
}
