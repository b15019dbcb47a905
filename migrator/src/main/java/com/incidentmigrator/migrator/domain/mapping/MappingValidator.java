package com.incidentmigrator.migrator.domain.mapping;

import com.incidentmigrator.common.marker.MarkerGrammar;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pre-flight check that every provider service referenced by the monitors can be migrated.
 */
@Slf4j
@Component
public class MappingValidator {

    private static final Pattern VALID_TEAM_NAME = Pattern.compile("^[a-z0-9-]+$");

    /**
     * Classifies the union of provider services referenced across {@code alerts}.
     *
     * @param teamIdentityRequired true when webhooks are per team or team tags are added; only then
     *                             are team names checked for well-formedness
     */
    public ValidationReport validate(List<AlertDefinition> alerts, MappingTable table, boolean teamIdentityRequired) {
        var referenced = new LinkedHashSet<String>();
        for (var alert : alerts) {
            referenced.addAll(MarkerGrammar.findProviderMarkers(alert.message(), table.provider()));
        }

        var mapped = new LinkedHashSet<String>();
        var unmapped = new LinkedHashSet<String>();
        var nullMapped = new LinkedHashSet<String>();
        var malformed = new LinkedHashMap<String, String>();

        for (var service : referenced) {
            var mapping = table.lookup(service);
            if (mapping.isEmpty()) {
                unmapped.add(service);
            } else if (mapping.get().team().isEmpty()) {
                nullMapped.add(service);
            } else {
                mapped.add(service);
                var team = mapping.get().destinationTeam();
                if (teamIdentityRequired && !VALID_TEAM_NAME.matcher(team).matches()) {
                    malformed.put(service, team);
                }
            }
        }

        log.debug("Validated {} referenced services: {} unmapped, {} without team, {} malformed team names",
                referenced.size(), unmapped.size(), nullMapped.size(), malformed.size());

        return ValidationReport.builder()
                .mapped(mapped)
                .unmapped(unmapped)
                .nullMapped(nullMapped)
                .malformedTeamNames(malformed)
                .teamIdentityRequired(teamIdentityRequired)
                .build();
    }
}
