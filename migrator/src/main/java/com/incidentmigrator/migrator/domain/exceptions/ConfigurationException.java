package com.incidentmigrator.migrator.domain.exceptions;

import java.util.Collection;

public class ConfigurationException extends RuntimeException {

    private ConfigurationException(String message) {
        super(message);
    }

    private ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException unmappedServices(String providerName, Collection<String> services) {
        return new ConfigurationException("Missing mappings for " + providerName + " services: "
                + String.join(", ", services)
                + ". Please add these services to your config file before migrating.");
    }

    public static ConfigurationException missingTeamAssignments(String context, String providerName, Collection<String> services) {
        return new ConfigurationException(context + ", all " + providerName + " services must have team assignments. "
                + "Missing team assignments for: " + String.join(", ", services));
    }

    public static ConfigurationException invalidTeamNames(String context, Collection<String> descriptions) {
        return new ConfigurationException(context
                + ", team names must be lowercase alphanumeric with hyphens. Invalid team names for services: "
                + String.join(", ", descriptions));
    }

    public static ConfigurationException missingField(String field) {
        return new ConfigurationException("Missing required configuration value: " + field);
    }

    public static ConfigurationException unreadableFile(String path, Throwable cause) {
        return new ConfigurationException("Failed to load config " + path + ": " + cause.getMessage(), cause);
    }

    public static ConfigurationException unwritableFile(String path, Throwable cause) {
        return new ConfigurationException("Failed to write config " + path + ": " + cause.getMessage(), cause);
    }

    public static ConfigurationException invalidValue(String field, String value) {
        return new ConfigurationException("Invalid value for " + field + ": " + value);
    }
}
