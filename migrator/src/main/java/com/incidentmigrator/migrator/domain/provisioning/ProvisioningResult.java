package com.incidentmigrator.migrator.domain.provisioning;

public record ProvisioningResult(String resourceName, boolean success, String reason) {

    public static ProvisioningResult available(String resourceName) {
        return new ProvisioningResult(resourceName, true, null);
    }

    public static ProvisioningResult failed(String resourceName, String reason) {
        return new ProvisioningResult(resourceName, false, reason);
    }
}
