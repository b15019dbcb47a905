package com.incidentmigrator.migrator.application.runner;

import com.incidentmigrator.migrator.domain.analysis.AnalysisReport;
import com.incidentmigrator.migrator.domain.mapping.MappingGenerator;
import com.incidentmigrator.migrator.domain.mapping.ValidationReport;
import com.incidentmigrator.migrator.domain.reconciliation.ChangeRecord;
import com.incidentmigrator.migrator.domain.reconciliation.OutcomeStatus;
import com.incidentmigrator.migrator.domain.reconciliation.RunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Renders run outcomes to the log, the migrator's only user-facing output.
 */
@Slf4j
@Component
public class RunReportLogger {

    public void report(RunResult result) {
        log.info("{}{}: processed {}, updated {}, unchanged {}, errors {}",
                result.operation(), result.simulated() ? " (dry run)" : "",
                result.processed(), result.updated(), result.unchanged(), result.errors().size());

        if (result.validation() != null) {
            report(result.validation());
        }
        for (var change : result.changes()) {
            report(change, result.simulated());
        }
        for (var error : result.errors()) {
            log.warn("Monitor {} failed: {}", error.alertId(), error.error());
        }
        if (result.simulated() && result.updated() > 0) {
            log.info("Dry run: no changes were made. Set migrator.dry-run=false to apply {} updates",
                    result.updated());
        }
    }

    public void report(AnalysisReport report) {
        log.info("Monitors: {} total, {} with provider markers, {} with incident.io webhooks, {} with both, "
                        + "{} with neither",
                report.totalMonitors(), report.withProvider(), report.withDestination(), report.withBoth(),
                report.withNeither());
        for (var occurrence : report.providerServices()) {
            log.info("  service {}: {} monitors", occurrence.name(), occurrence.count());
        }
        for (var occurrence : report.destinationMarkers()) {
            log.info("  webhook {}: {} monitors", occurrence.name(), occurrence.count());
        }
        report(report.validation());
    }

    public void report(MappingGenerator.MappingMerge merge) {
        log.info("Detected {} services, added {} new mapping entries, {} total",
                merge.detectedServices(), merge.addedServices().size(), merge.mappings().size());
        if (!merge.addedServices().isEmpty()) {
            log.info("Fill in incidentioTeam for: {}", String.join(", ", merge.addedServices()));
        }
    }

    private void report(ValidationReport validation) {
        if (validation.valid()) {
            log.info("Mappings valid: {} services mapped", validation.mapped().size());
            return;
        }
        if (!validation.unmapped().isEmpty()) {
            log.warn("Services without a mapping: {}", String.join(", ", validation.unmapped()));
        }
        if (!validation.nullMapped().isEmpty()) {
            log.warn("Services without a team: {}", String.join(", ", validation.nullMapped()));
        }
        if (!validation.malformedTeamNames().isEmpty()) {
            log.warn("Invalid team names: {}", String.join(", ", validation.malformedDescriptions()));
        }
    }

    private void report(ChangeRecord change, boolean simulated) {
        if (change.status() == OutcomeStatus.UPDATED) {
            log.info("{} monitor {} ({})", simulated ? "Would update" : "Updated", change.id(), change.name());
            if (change.messageChanged()) {
                log.info("  before: {}", change.before());
                log.info("  after:  {}", change.after());
            }
            var added = addedTags(change);
            if (!added.isEmpty()) {
                log.info("  added tags: {}", String.join(", ", added));
            }
            return;
        }
        if (change.status() == OutcomeStatus.UPDATE_FAILED) {
            log.warn("Monitor {} ({}) not updated: {}", change.id(), change.name(), change.reason());
            return;
        }
        log.info("Skipped monitor {} ({}): {}", change.id(), change.name(), change.reason());
    }

    private static List<String> addedTags(ChangeRecord change) {
        if (change.tagsAfter() == null) {
            return List.of();
        }
        var added = new LinkedHashSet<>(change.tagsAfter());
        if (change.tagsBefore() != null) {
            added.removeAll(change.tagsBefore());
        }
        return List.copyOf(added);
    }
}
