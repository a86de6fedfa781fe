package com.ragpipe.worker;

import com.ragpipe.activity.ActivityCatalog;
import com.ragpipe.config.RagPipeConfig;
import com.ragpipe.pipeline.load.ServiceConfigHolder;
import com.ragpipe.pipeline.load.ServiceConfigSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a worker process needs once bootstrap has succeeded: settings, the orchestrator's configuration
 * holder and source (absent when the process does not orchestrate), and the activity catalog per hosted
 * service task queue.
 */
public final class WorkerContext {

    /** One hosted service: its advertised name and the activities served on its task queue. */
    public static final class HostedService {
        private final String serviceName;
        private final ActivityCatalog catalog;

        public HostedService(String serviceName, ActivityCatalog catalog) {
            this.serviceName = serviceName;
            this.catalog = catalog;
        }

        public String getServiceName() {
            return serviceName;
        }

        public ActivityCatalog getCatalog() {
            return catalog;
        }
    }

    private final RagPipeConfig config;
    private final ServiceConfigHolder configHolder;
    private final ServiceConfigSource configSource;
    private final ActivityCatalog localActivities;
    private final Map<String, HostedService> servicesByQueue;

    public WorkerContext(RagPipeConfig config, ServiceConfigHolder configHolder, ServiceConfigSource configSource,
                         ActivityCatalog localActivities, Map<String, HostedService> servicesByQueue) {
        this.config = Objects.requireNonNull(config, "config");
        this.configHolder = configHolder;
        this.configSource = configSource;
        this.localActivities = Objects.requireNonNull(localActivities, "localActivities");
        this.servicesByQueue = Collections.unmodifiableMap(new LinkedHashMap<>(servicesByQueue));
    }

    public RagPipeConfig getConfig() {
        return config;
    }

    public boolean isOrchestrator() {
        return configHolder != null;
    }

    public Optional<ServiceConfigHolder> getConfigHolder() {
        return Optional.ofNullable(configHolder);
    }

    public Optional<ServiceConfigSource> getConfigSource() {
        return Optional.ofNullable(configSource);
    }

    public ActivityCatalog getLocalActivities() {
        return localActivities;
    }

    /** Task queue → hosted service, in start order. */
    public Map<String, HostedService> getServicesByQueue() {
        return servicesByQueue;
    }
}
