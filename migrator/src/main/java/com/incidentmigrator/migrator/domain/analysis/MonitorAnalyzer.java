package com.incidentmigrator.migrator.domain.analysis;

import com.incidentmigrator.common.marker.MarkerGrammar;
import com.incidentmigrator.migrator.domain.mapping.MappingTable;
import com.incidentmigrator.migrator.domain.mapping.MappingValidator;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class MonitorAnalyzer {

    private static final Comparator<AnalysisReport.Occurrence> MOST_FREQUENT_FIRST =
            Comparator.comparingInt(AnalysisReport.Occurrence::count).reversed()
                    .thenComparing(AnalysisReport.Occurrence::name);

    private final MappingValidator mappingValidator;

    public AnalysisReport analyze(List<AlertDefinition> alerts, MappingTable mappings, boolean teamIdentityRequired) {
        var provider = mappings.provider();
        var serviceCounts = new HashMap<String, Integer>();
        var markerCounts = new HashMap<String, Integer>();
        int withProvider = 0;
        int withDestination = 0;
        int withBoth = 0;

        for (var alert : alerts) {
            var services = MarkerGrammar.findProviderMarkers(alert.message(), provider);
            var markers = MarkerGrammar.findDestinationMarkers(alert.message());
            services.forEach(service -> serviceCounts.merge(service, 1, Integer::sum));
            markers.forEach(marker -> markerCounts.merge(marker, 1, Integer::sum));

            if (!services.isEmpty()) {
                withProvider++;
            }
            if (!markers.isEmpty()) {
                withDestination++;
            }
            if (!services.isEmpty() && !markers.isEmpty()) {
                withBoth++;
            }
        }

        var withNeither = alerts.size() - withProvider - withDestination + withBoth;
        log.debug("Analyzed {} monitors: {} with {} markers, {} with incident.io webhooks", alerts.size(),
                withProvider, provider.getDisplayName(), withDestination);

        return AnalysisReport.builder()
                .totalMonitors(alerts.size())
                .withProvider(withProvider)
                .withDestination(withDestination)
                .withBoth(withBoth)
                .withNeither(withNeither)
                .providerServices(ranked(serviceCounts))
                .destinationMarkers(ranked(markerCounts))
                .validation(mappingValidator.validate(alerts, mappings, teamIdentityRequired))
                .build();
    }

    private static List<AnalysisReport.Occurrence> ranked(Map<String, Integer> counts) {
        return counts.entrySet().stream()
                .map(entry -> new AnalysisReport.Occurrence(entry.getKey(), entry.getValue()))
                .sorted(MOST_FREQUENT_FIRST)
                .toList();
    }
}
