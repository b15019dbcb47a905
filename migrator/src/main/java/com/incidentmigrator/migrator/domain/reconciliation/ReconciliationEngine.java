package com.incidentmigrator.migrator.domain.reconciliation;

import com.incidentmigrator.common.marker.AnnotatedMessage;
import com.incidentmigrator.common.marker.MarkerGrammar;
import com.incidentmigrator.migrator.domain.exceptions.ApiException;
import com.incidentmigrator.migrator.domain.exceptions.ConfigurationException;
import com.incidentmigrator.migrator.domain.mapping.MappingValidator;
import com.incidentmigrator.migrator.domain.mapping.ServiceMapping;
import com.incidentmigrator.migrator.domain.mapping.ValidationReport;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinitionRepository;
import com.incidentmigrator.migrator.domain.monitor.AlertUpdate;
import com.incidentmigrator.migrator.domain.provisioning.DestinationResourceGateway;
import com.incidentmigrator.migrator.domain.provisioning.ResourceProvisioner;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brings each monitor's markers and tags to the target state of the requested operation.
 *
 * <p>Monitors are processed one at a time in listing order. Every edit is computed in memory first;
 * the only remote mutations are webhook provisioning and a single update per changed monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final AlertDefinitionRepository alertRepository;
    private final DestinationResourceGateway resourceGateway;
    private final MappingValidator mappingValidator;
    private final Counter alertsUpdatedCounter;
    private final Counter alertUpdateFailuresCounter;
    private final Counter webhooksCreatedCounter;

    /**
     * @throws ConfigurationException when adding destinations outside a dry run and the mappings do not
     *                                cover every referenced provider service
     */
    public RunResult reconcile(List<AlertDefinition> alerts, Operation operation, MigrationSettings settings,
                               ReconciliationOptions options) {
        var selected = options.filter().apply(alerts);
        var destination = settings.destination();

        ValidationReport validation = null;
        if (operation == Operation.ADD_DESTINATION) {
            validation = mappingValidator.validate(selected, settings.mappings(), destination.requiresTeamIdentity());
            if (!validation.valid()) {
                if (options.simulate()) {
                    log.warn("Mapping validation failed; continuing because this is a dry run");
                } else {
                    throw rejection(validation, destination);
                }
            }
        }

        var run = new Run(settings, new ResourceProvisioner(resourceGateway, destination.url(),
                destination.authToken(), options.simulate(), webhooksCreatedCounter));

        var processed = 0;
        var updated = 0;
        var unchanged = 0;
        var changes = new ArrayList<ChangeRecord>();
        var errors = new ArrayList<RunError>();

        for (var alert : selected) {
            ReconciliationOutcome outcome;
            try {
                outcome = commit(alert, run.reconcile(alert, operation), options.simulate());
            } catch (RuntimeException e) {
                log.error("Failed to process monitor {}: {}", alert.id(), e.getMessage(), e);
                errors.add(new RunError(alert.id(), e.getMessage()));
                continue;
            }

            processed++;
            if (outcome.updated()) {
                updated++;
            } else {
                unchanged++;
            }
            if (outcome.status() == OutcomeStatus.UPDATE_FAILED) {
                errors.add(new RunError(alert.id(), outcome.error()));
            }
            if (options.verbose() || outcome.updated() || outcome.status() == OutcomeStatus.UPDATE_FAILED) {
                changes.add(toChangeRecord(alert, outcome));
            }
        }

        log.info("{} finished: {} processed, {} updated, {} unchanged, {} errors{}", operation, processed, updated,
                unchanged, errors.size(), options.simulate() ? " (dry run)" : "");

        return RunResult.builder()
                .operation(operation)
                .simulated(options.simulate())
                .processed(processed)
                .updated(updated)
                .unchanged(unchanged)
                .changes(changes)
                .errors(errors)
                .validation(validation)
                .build();
    }

    private ReconciliationOutcome commit(AlertDefinition alert, ReconciliationOutcome outcome, boolean simulate) {
        if (!outcome.updated()) {
            return outcome;
        }
        if (simulate) {
            log.debug("Dry run: not updating monitor {}", alert.id());
            return outcome;
        }
        try {
            alertRepository.update(alert.id(), new AlertUpdate(outcome.newMessage(), outcome.newTags()));
        } catch (ApiException e) {
            log.error("Failed to update monitor {}: {}", alert.id(), e.getMessage());
            alertUpdateFailuresCounter.increment();
            return outcome.toBuilder()
                    .status(OutcomeStatus.UPDATE_FAILED)
                    .reason("API update failed: " + e.getMessage())
                    .error(e.getMessage())
                    .build();
        }
        alertsUpdatedCounter.increment();
        log.info("Updated monitor {} ({}) - {}", alert.id(), alert.name(),
                outcome.newTags() != null ? "message and tags" : "message");
        return outcome;
    }

    private static ChangeRecord toChangeRecord(AlertDefinition alert, ReconciliationOutcome outcome) {
        var applied = outcome.status() == OutcomeStatus.UPDATED;
        return ChangeRecord.builder()
                .id(alert.id())
                .name(alert.name())
                .status(outcome.status())
                .before(alert.message())
                .after(applied ? outcome.newMessage() : alert.message())
                .tagsBefore(outcome.newTags() != null ? alert.tags() : null)
                .tagsAfter(outcome.newTags())
                .reason(outcome.reason())
                .build();
    }

    private static ConfigurationException rejection(ValidationReport validation, DestinationConfig destination) {
        var providerName = destination.provider().getDisplayName();
        if (!validation.unmapped().isEmpty()) {
            return ConfigurationException.unmappedServices(providerName, validation.unmapped());
        }
        if (!validation.nullMapped().isEmpty()) {
            return ConfigurationException.missingTeamAssignments(destination.teamIdentityContext(), providerName,
                    validation.nullMapped());
        }
        return ConfigurationException.invalidTeamNames(destination.teamIdentityContext(),
                validation.malformedDescriptions());
    }

    /**
     * State of one run: the loaded settings and the webhook provisioner shared by all of its monitors.
     */
    @RequiredArgsConstructor
    private static final class Run {

        private final MigrationSettings settings;
        private final ResourceProvisioner provisioner;

        ReconciliationOutcome reconcile(AlertDefinition alert, Operation operation) {
            var message = AnnotatedMessage.parse(alert.message(), settings.destination().provider());
            return switch (operation) {
                case ADD_DESTINATION -> addDestination(alert, message);
                case REMOVE_DESTINATION -> removeDestination(alert, message);
                case REMOVE_PROVIDER -> removeProvider(alert, message);
            };
        }

        private ReconciliationOutcome addDestination(AlertDefinition alert, AnnotatedMessage message) {
            var services = message.providerServiceKeys();
            if (services.isEmpty()) {
                return noProviderServices(alert);
            }
            var destination = settings.destination();
            if (destination instanceof SingleWebhook single) {
                return addSingleWebhook(alert, message, services, single);
            }
            return addTeamWebhooks(alert, message, services);
        }

        private ReconciliationOutcome addSingleWebhook(AlertDefinition alert, AnnotatedMessage message,
                                                       List<String> services, SingleWebhook single) {
            var resourceName = MarkerGrammar.resourceNameFor(null);
            var provisioning = provisioner.ensureExists(resourceName, null, Map.of());
            if (!provisioning.success()) {
                return ReconciliationOutcome.skipped(alert.id(), alert.message(),
                        "Failed to create required webhook: " + provisioning.reason());
            }

            var newTags = single.annotateTeamTags() ? teamTags(alert, services, single) : null;

            var canonical = MarkerGrammar.markerFor(resourceName);
            var existing = message.destinationMarkers();
            if (existing.equals(List.of(canonical))) {
                if (newTags != null) {
                    return ReconciliationOutcome.updated(alert.id(), alert.message(), newTags);
                }
                return ReconciliationOutcome.unchanged(alert.id(), alert.message(),
                        "Already has correct incident.io webhook");
            }

            var newMessage = message.withoutDestinationMarkers().append(canonical).render();
            log.debug("Monitor {}: replacing {} with {}", alert.id(), existing, canonical);
            return ReconciliationOutcome.updated(alert.id(), newMessage, newTags);
        }

        /**
         * The alert's tags plus any missing team and metadata tags, or null when nothing is missing.
         */
        private Set<String> teamTags(AlertDefinition alert, List<String> services, SingleWebhook single) {
            var tags = new LinkedHashSet<>(alert.tags());
            var added = false;
            for (var service : services) {
                var mapping = settings.mappings().lookup(service);
                var team = mapping.flatMap(ServiceMapping::team);
                if (team.isEmpty()) {
                    continue;
                }
                added |= tags.add(single.teamTag(team.get()));
                for (var entry : mapping.get().metadata().entrySet()) {
                    added |= tags.add(entry.getKey() + ":" + entry.getValue());
                }
            }
            if (!added) {
                return null;
            }
            log.debug("Monitor {}: tags {} -> {}", alert.id(), alert.tags(), tags);
            return tags;
        }

        private ReconciliationOutcome addTeamWebhooks(AlertDefinition alert, AnnotatedMessage message,
                                                      List<String> services) {
            var mappings = settings.mappings();
            var expected = new LinkedHashSet<String>();
            for (var service : services) {
                var team = mappings.teamFor(service).orElse(null);
                var resourceName = MarkerGrammar.resourceNameFor(team);
                var metadata = mappings.lookup(service).map(ServiceMapping::metadata).orElse(Map.of());
                var provisioning = provisioner.ensureExists(resourceName, team, metadata);
                if (!provisioning.success()) {
                    return ReconciliationOutcome.skipped(alert.id(), alert.message(),
                            "Failed to create required webhook for team " + (team == null ? "unknown" : team)
                                    + ": " + provisioning.reason());
                }
                expected.add(MarkerGrammar.markerFor(resourceName));
            }

            var existing = message.destinationMarkers();
            // duplicates count as a mismatch, so sizes must agree as well as contents
            if (existing.size() == expected.size() && new HashSet<>(existing).equals(expected)) {
                return ReconciliationOutcome.unchanged(alert.id(), alert.message(),
                        "Already has all correct incident.io webhooks");
            }

            var rewritten = message.withoutDestinationMarkers();
            for (var marker : expected) {
                rewritten = rewritten.append(marker);
            }
            log.debug("Monitor {}: replacing {} with {}", alert.id(), existing, expected);
            return ReconciliationOutcome.updated(alert.id(), rewritten.render(), null);
        }

        private ReconciliationOutcome removeDestination(AlertDefinition alert, AnnotatedMessage message) {
            if (message.destinationMarkers().isEmpty()) {
                return ReconciliationOutcome.unchanged(alert.id(), alert.message(), "No incident.io webhooks found");
            }
            return ReconciliationOutcome.updated(alert.id(), message.withoutDestinationMarkers().render(), null);
        }

        private ReconciliationOutcome removeProvider(AlertDefinition alert, AnnotatedMessage message) {
            if (message.providerServiceKeys().isEmpty()) {
                return noProviderServices(alert);
            }
            return ReconciliationOutcome.updated(alert.id(), message.withoutProviderMarkers().render(), null);
        }

        private ReconciliationOutcome noProviderServices(AlertDefinition alert) {
            return ReconciliationOutcome.unchanged(alert.id(), alert.message(),
                    "No " + settings.destination().provider().getDisplayName() + " services found");
        }
    }
}
