package com.ragpipe.discovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Read-through cache holding one {@link ServiceCatalog} for a fixed TTL. The entry is swapped as a whole.
 * Not stampede-proof: concurrent misses may each load, and the last one wins.
 */
public final class CatalogCache {

    private static final class Entry {
        final ServiceCatalog catalog;
        final Instant expiresAt;

        Entry(ServiceCatalog catalog, Instant expiresAt) {
            this.catalog = catalog;
            this.expiresAt = expiresAt;
        }
    }

    private final Duration ttl;
    private final Clock clock;
    private final AtomicReference<Entry> entry = new AtomicReference<>();

    public CatalogCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Returns the cached catalog if still fresh, otherwise loads, stores and returns a new one. */
    public ServiceCatalog getOrLoad(Supplier<ServiceCatalog> loader) {
        Entry current = entry.get();
        Instant now = clock.instant();
        if (current != null && now.isBefore(current.expiresAt)) {
            return current.catalog;
        }
        ServiceCatalog loaded = loader.get();
        entry.set(new Entry(loaded, clock.instant().plus(ttl)));
        return loaded;
    }

    /** Cached catalog regardless of age. */
    public Optional<ServiceCatalog> peek() {
        Entry current = entry.get();
        return current != null ? Optional.of(current.catalog) : Optional.empty();
    }

    public Duration getTtl() {
        return ttl;
    }
}
