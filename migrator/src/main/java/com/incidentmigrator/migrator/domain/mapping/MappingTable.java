package com.incidentmigrator.migrator.domain.mapping;

import com.incidentmigrator.common.marker.Provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the configured service mappings, scoped to one provider's key namespace.
 * When a key is listed twice the first entry wins.
 */
public final class MappingTable {

    private final Provider provider;
    private final List<ServiceMapping> mappings;
    private final Map<String, ServiceMapping> byServiceKey = new LinkedHashMap<>();

    public MappingTable(Provider provider, List<ServiceMapping> mappings) {
        this.provider = provider;
        this.mappings = List.copyOf(mappings);
        for (var mapping : this.mappings) {
            if (mapping.provider() == provider && mapping.sourceServiceKey() != null) {
                byServiceKey.putIfAbsent(mapping.sourceServiceKey(), mapping);
            }
        }
    }

    public static MappingTable empty(Provider provider) {
        return new MappingTable(provider, List.of());
    }

    public Provider provider() {
        return provider;
    }

    /**
     * Every configured mapping, including the ones for the other provider.
     */
    public List<ServiceMapping> mappings() {
        return mappings;
    }

    public Optional<ServiceMapping> lookup(String serviceKey) {
        return Optional.ofNullable(byServiceKey.get(serviceKey));
    }

    public Optional<String> teamFor(String serviceKey) {
        return lookup(serviceKey).flatMap(ServiceMapping::team);
    }
}
