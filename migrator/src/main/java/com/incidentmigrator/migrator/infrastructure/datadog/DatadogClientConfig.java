package com.incidentmigrator.migrator.infrastructure.datadog;

import com.incidentmigrator.migrator.application.config.MigratorProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
public class DatadogClientConfig {

    static final String API_KEY_HEADER = "DD-API-KEY";
    static final String APPLICATION_KEY_HEADER = "DD-APPLICATION-KEY";

    @Bean
    public RestClient datadogRestClient(MigratorProperties properties) {
        return configure(RestClient.builder(), properties.datadog()).build();
    }

    /**
     * Applies base URL and credentials; also used by tests that bind a mock server to the builder.
     */
    public static RestClient.Builder configure(RestClient.Builder builder, MigratorProperties.Datadog datadog) {
        return builder.baseUrl(datadog.baseUrl())
                .defaultHeader(API_KEY_HEADER, nullToEmpty(datadog.apiKey()))
                .defaultHeader(APPLICATION_KEY_HEADER, nullToEmpty(datadog.appKey()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
