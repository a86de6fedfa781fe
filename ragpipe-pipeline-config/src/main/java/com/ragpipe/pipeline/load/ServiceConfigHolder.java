package com.ragpipe.pipeline.load;

import com.ragpipe.pipeline.ServiceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link ServiceConfig}. Reload swaps the whole table; a failed reload keeps the previous one,
 * so runs in flight never see a half-built table.
 */
public final class ServiceConfigHolder {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigHolder.class);

    private final AtomicReference<ServiceConfig> current;

    public ServiceConfigHolder(ServiceConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    /** Loads the first table; failure propagates (startup must not continue without configuration). */
    public static ServiceConfigHolder initialize(ServiceConfigSource source) {
        ServiceConfig config = source.load();
        log.info("Service configuration initialized from {}: {}", source.describe(), config);
        return new ServiceConfigHolder(config);
    }

    public ServiceConfig get() {
        return current.get();
    }

    /**
     * Replaces the table with a fresh load from {@code source}.
     *
     * @return true if the table was replaced; false if loading failed and the previous table was kept
     */
    public boolean reload(ServiceConfigSource source) {
        ServiceConfig next;
        try {
            next = source.load();
        } catch (RuntimeException e) {
            log.warn("Service configuration reload from {} failed; keeping previous configuration ({}): {}",
                    source.describe(), current.get().getSource(), e.getMessage(), e);
            return false;
        }
        ServiceConfig previous = current.getAndSet(next);
        if (!previous.getPipelines().keySet().equals(next.getPipelines().keySet())
                || !previous.getActivities().keySet().equals(next.getActivities().keySet())) {
            log.info("Service configuration reloaded from {}: {}", source.describe(), next);
        } else {
            log.debug("Service configuration reloaded from {} (no name changes)", source.describe());
        }
        return true;
    }
}
