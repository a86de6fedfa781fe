package com.ragpipe.worker;

import com.ragpipe.pipeline.load.ServiceConfigHolder;
import com.ragpipe.pipeline.load.ServiceConfigSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically reloads the service configuration from its source (discovery mode). A failed reload keeps the
 * previous table; runs already started keep the plan they resolved.
 */
public final class ConfigRefresher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigRefresher.class);

    private final ServiceConfigHolder holder;
    private final ServiceConfigSource source;
    private final ScheduledExecutorService scheduler;

    private ConfigRefresher(ServiceConfigHolder holder, ServiceConfigSource source) {
        this.holder = Objects.requireNonNull(holder, "holder");
        this.source = Objects.requireNonNull(source, "source");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    public static ConfigRefresher start(ServiceConfigHolder holder, ServiceConfigSource source, Duration period) {
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Refresh period must be positive: " + period);
        }
        ConfigRefresher refresher = new ConfigRefresher(holder, source);
        long millis = period.toMillis();
        refresher.scheduler.scheduleWithFixedDelay(refresher::refresh, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Refreshing service configuration from {} every {}s", source.describe(), period.toSeconds());
        return refresher;
    }

    /** One reload; exceptions are logged here so the schedule keeps running. */
    boolean refresh() {
        try {
            return holder.reload(source);
        } catch (RuntimeException e) {
            log.error("Service configuration refresh failed: {}", e.getMessage(), e);
            return false;
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
