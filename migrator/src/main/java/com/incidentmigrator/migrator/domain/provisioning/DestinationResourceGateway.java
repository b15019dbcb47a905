package com.incidentmigrator.migrator.domain.provisioning;

import java.util.Optional;

public interface DestinationResourceGateway {

    /**
     * @return the resource, or empty if the platform has none with that name
     * @throws com.incidentmigrator.migrator.domain.exceptions.ApiException on any other failure
     */
    Optional<DestinationResource> findByName(String name);

    /**
     * @throws com.incidentmigrator.migrator.domain.exceptions.ApiException if the platform rejects the resource
     */
    void create(DestinationResource resource);
}
