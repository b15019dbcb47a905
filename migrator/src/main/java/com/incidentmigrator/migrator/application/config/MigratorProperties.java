package com.incidentmigrator.migrator.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "migrator")
public record MigratorProperties(
        MigratorCommand operation,
        String configFile,
        @DefaultValue("true") boolean dryRun,
        @DefaultValue("true") boolean verbose,
        @DefaultValue Filter filter,
        @NotNull @Valid Datadog datadog,
        @DefaultValue Incidentio incidentio) {

    public record Filter(List<String> tags, String namePattern, String messagePattern) {

        public Filter {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    public record Datadog(@NotBlank String baseUrl, String apiKey, String appKey) {}

    public record Incidentio(String webhookToken) {}
}
