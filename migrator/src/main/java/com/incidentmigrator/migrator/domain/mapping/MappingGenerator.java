package com.incidentmigrator.migrator.domain.mapping;

import com.incidentmigrator.common.marker.MarkerGrammar;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Adds placeholder mappings for provider services found in monitors but missing from the config.
 */
@Component
public class MappingGenerator {

    public MappingMerge merge(MappingTable existing, List<AlertDefinition> alerts) {
        var detected = new TreeSet<String>();
        for (var alert : alerts) {
            detected.addAll(MarkerGrammar.findProviderMarkers(alert.message(), existing.provider()));
        }

        var merged = new ArrayList<>(existing.mappings());
        var added = new ArrayList<String>();
        for (var service : detected) {
            if (existing.lookup(service).isEmpty()) {
                merged.add(ServiceMapping.builder()
                        .provider(existing.provider())
                        .sourceServiceKey(service)
                        .build());
                added.add(service);
            }
        }
        return new MappingMerge(List.copyOf(merged), List.copyOf(added), detected.size());
    }

    public record MappingMerge(List<ServiceMapping> mappings, List<String> addedServices, int detectedServices) {}
}
