package com.incidentmigrator.migrator.domain.mapping;

import com.incidentmigrator.common.marker.Provider;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Association from a provider service to an incident.io team. A null or blank {@code destinationTeam}
 * means the service is known but not yet assigned.
 */
@Builder(toBuilder = true)
public record ServiceMapping(
        Provider provider,
        String sourceServiceKey,
        String destinationTeam,
        Map<String, String> metadata
) {

    public ServiceMapping {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<String> team() {
        return destinationTeam == null || destinationTeam.isBlank() ? Optional.empty() : Optional.of(destinationTeam);
    }
}
