package com.incidentmigrator.migrator.application.config;

import com.incidentmigrator.common.json.JacksonConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties(MigratorProperties.class)
public class MigratorConfig {

    @Bean
    public JsonMapper migratorJsonMapper() {
        return JacksonConfig.createJsonMapper();
    }
}
