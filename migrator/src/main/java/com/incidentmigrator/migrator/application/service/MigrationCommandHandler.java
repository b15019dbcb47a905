package com.incidentmigrator.migrator.application.service;

import com.incidentmigrator.migrator.domain.analysis.AnalysisReport;
import com.incidentmigrator.migrator.domain.analysis.MonitorAnalyzer;
import com.incidentmigrator.migrator.domain.mapping.MappingGenerator;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinitionRepository;
import com.incidentmigrator.migrator.domain.reconciliation.MigrationSettingsStore;
import com.incidentmigrator.migrator.domain.reconciliation.Operation;
import com.incidentmigrator.migrator.domain.reconciliation.ReconciliationEngine;
import com.incidentmigrator.migrator.domain.reconciliation.ReconciliationOptions;
import com.incidentmigrator.migrator.domain.reconciliation.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationCommandHandler {

    private final MigrationSettingsStore settingsStore;
    private final AlertDefinitionRepository alertRepository;
    private final ReconciliationEngine reconciliationEngine;
    private final MonitorAnalyzer monitorAnalyzer;
    private final MappingGenerator mappingGenerator;

    public RunResult reconcile(Operation operation, MigrationRequest request) {
        var settings = settingsStore.load(request.configFile(), request.fallbackAuthToken());
        var alerts = alertRepository.findAll();
        log.info("Running {} over {} monitors{}", operation, alerts.size(), request.dryRun() ? " (dry run)" : "");

        var options = ReconciliationOptions.builder()
                .simulate(request.dryRun())
                .verbose(request.verbose())
                .filter(request.filter())
                .build();
        return reconciliationEngine.reconcile(alerts, operation, settings, options);
    }

    public AnalysisReport analyze(MigrationRequest request) {
        var settings = settingsStore.load(request.configFile(), request.fallbackAuthToken());
        var alerts = filtered(request);
        return monitorAnalyzer.analyze(alerts, settings.mappings(), settings.destination().requiresTeamIdentity());
    }

    /**
     * Adds placeholder mappings for newly detected services and writes them back to the config document,
     * creating it when missing.
     */
    public MappingGenerator.MappingMerge generateMappings(MigrationRequest request) {
        var settings = settingsStore.loadOrCreate(request.configFile(), request.fallbackAuthToken());
        var merge = mappingGenerator.merge(settings.mappings(), filtered(request));
        settingsStore.saveMappings(request.configFile(), merge.mappings());
        return merge;
    }

    private List<AlertDefinition> filtered(MigrationRequest request) {
        var alerts = alertRepository.findAll();
        var selected = request.filter().apply(alerts);
        if (!request.filter().isEmpty()) {
            log.info("Filter kept {} of {} monitors", selected.size(), alerts.size());
        }
        return selected;
    }
}
