package com.incidentmigrator.migrator.domain.monitor;

import java.util.List;

public interface AlertDefinitionRepository {

    /**
     * @throws com.incidentmigrator.migrator.domain.exceptions.ConnectivityException if the list cannot be fetched
     */
    List<AlertDefinition> findAll();

    /**
     * @throws com.incidentmigrator.migrator.domain.exceptions.ApiException if the platform rejects the update
     */
    AlertDefinition update(long id, AlertUpdate update);
}
