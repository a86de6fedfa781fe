package com.ragpipe.discovery;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Snapshot of discovered services keyed by service name. Immutable; a refresh builds a new one. */
public final class ServiceCatalog {

    private final Map<String, DiscoveredService> services;
    private final Instant discoveredAt;

    public ServiceCatalog(Map<String, DiscoveredService> services, Instant discoveredAt) {
        this.services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        this.discoveredAt = Objects.requireNonNull(discoveredAt, "discoveredAt");
    }

    public Map<String, DiscoveredService> getServices() {
        return services;
    }

    public Collection<DiscoveredService> services() {
        return services.values();
    }

    public Optional<DiscoveredService> getService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    public boolean isEmpty() {
        return services.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceCatalog that = (ServiceCatalog) o;
        return services.equals(that.services) && discoveredAt.equals(that.discoveredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(services, discoveredAt);
    }

    @Override
    public String toString() {
        return "ServiceCatalog{at=" + discoveredAt + ", services=" + services.values() + "}";
    }
}
