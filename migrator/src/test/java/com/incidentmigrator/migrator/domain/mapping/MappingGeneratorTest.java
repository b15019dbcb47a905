package com.incidentmigrator.migrator.domain.mapping;

import com.incidentmigrator.common.marker.Provider;
import com.incidentmigrator.migrator.domain.monitor.AlertDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MappingGeneratorTest {

    private final MappingGenerator generator = new MappingGenerator();

    @Test
    void shouldAppendSortedPlaceholdersForNewServices() {
        // given
        var existing = new MappingTable(Provider.PAGERDUTY, List.of(ServiceMapping.builder()
                .provider(Provider.PAGERDUTY)
                .sourceServiceKey("api")
                .destinationTeam("api-team")
                .build()));
        var alerts = List.of(
                alert(1, "@pagerduty-zeta @pagerduty-api"),
                alert(2, "@pagerduty-alpha @pagerduty-zeta"));

        // when
        var merge = generator.merge(existing, alerts);

        // then
        assertThat(merge.detectedServices()).isEqualTo(3);
        assertThat(merge.addedServices()).containsExactly("alpha", "zeta");
        assertThat(merge.mappings()).extracting(ServiceMapping::sourceServiceKey)
                .containsExactly("api", "alpha", "zeta");
        assertThat(merge.mappings().get(1).destinationTeam()).isNull();
        assertThat(merge.mappings().get(1).provider()).isEqualTo(Provider.PAGERDUTY);
    }

    @Test
    void shouldKeepMappingsOfOtherProvider() {
        // given
        var opsgenie = ServiceMapping.builder()
                .provider(Provider.OPSGENIE)
                .sourceServiceKey("db")
                .destinationTeam("db-team")
                .build();
        var existing = new MappingTable(Provider.PAGERDUTY, List.of(opsgenie));

        // when
        var merge = generator.merge(existing, List.of(alert(1, "@pagerduty-db")));

        // then
        assertThat(merge.mappings()).hasSize(2).first().isEqualTo(opsgenie);
        assertThat(merge.addedServices()).containsExactly("db");
    }

    private static AlertDefinition alert(long id, String message) {
        return AlertDefinition.builder().id(id).name("Monitor " + id).message(message).build();
    }
}
