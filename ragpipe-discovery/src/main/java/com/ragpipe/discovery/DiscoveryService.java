package com.ragpipe.discovery;

import com.ragpipe.config.WorkerEndpoint;
import com.ragpipe.protocol.WorkerMetadataDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link ServiceCatalog} at runtime from two sources: worker metadata endpoints (what each service can do)
 * and the Temporal control plane (which task queues have live pollers).
 * <p>
 * Individual endpoint or queue failures are logged and that candidate is left out. Only an unreachable control
 * plane fails discovery as a whole.
 */
public final class DiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryService.class);

    private final List<WorkerEndpoint> endpoints;
    private final WorkerMetadataClient metadataClient;
    private final TaskQueueInspector inspector;
    private final CatalogCache cache;
    private final Clock clock;

    public DiscoveryService(List<WorkerEndpoint> endpoints, WorkerMetadataClient metadataClient,
                            TaskQueueInspector inspector, CatalogCache cache, Clock clock) {
        this.endpoints = List.copyOf(Objects.requireNonNull(endpoints, "endpoints"));
        this.metadataClient = Objects.requireNonNull(metadataClient, "metadataClient");
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Queries each configured worker endpoint. Unreachable or malformed endpoints are skipped;
     * partial results are normal.
     */
    public ServiceCatalog discoverServiceMetadata() {
        Map<String, DiscoveredService> services = new LinkedHashMap<>();
        for (WorkerEndpoint endpoint : endpoints) {
            Optional<WorkerMetadataDocument> doc;
            try {
                doc = metadataClient.fetch(endpoint);
            } catch (RuntimeException e) {
                log.warn("Metadata discovery failed for endpoint {}: {}", endpoint, e.getMessage());
                continue;
            }
            if (doc.isEmpty()) {
                log.debug("No metadata from endpoint {}", endpoint);
                continue;
            }
            DiscoveredService service = DiscoveredService.fromMetadata(doc.get(), endpoint);
            DiscoveredService previous = services.put(service.getServiceName(), service);
            if (previous != null) {
                log.warn("Service {} reported by both {} and {}; using the latter",
                        service.getServiceName(), previous.getEndpoint(), endpoint);
            }
            log.info("Discovered service {} at {} (queue={}, activities={})", service.getServiceName(), endpoint,
                    service.getTaskQueue(), service.getActivities().keySet());
        }
        log.info("Metadata discovery: {} of {} endpoints answered", services.size(), endpoints.size());
        return new ServiceCatalog(services, clock.instant());
    }

    /**
     * Active task queues among the candidates derived from the last cached catalog (if any)
     * and the configured endpoint names.
     *
     * @throws DiscoveryException if the control plane cannot be reached
     */
    public List<String> discoverActiveTaskQueues() {
        List<String> serviceNames = new ArrayList<>();
        List<String> declaredQueues = new ArrayList<>();
        cache.peek().ifPresent(catalog -> collect(catalog, serviceNames, declaredQueues));
        for (WorkerEndpoint endpoint : endpoints) {
            serviceNames.add(endpoint.getName());
        }
        return activeQueues(candidateQueues(serviceNames, declaredQueues));
    }

    /**
     * Metadata discovery cross-referenced with the control plane: each service is ACTIVE if its task queue has
     * pollers, otherwise INACTIVE (still listed). Cached for the cache's TTL.
     *
     * @throws DiscoveryException if the control plane cannot be reached
     */
    public ServiceCatalog discoverHybrid() {
        return cache.getOrLoad(this::loadHybrid);
    }

    private ServiceCatalog loadHybrid() {
        ServiceCatalog metadata = discoverServiceMetadata();
        List<String> serviceNames = new ArrayList<>();
        List<String> declaredQueues = new ArrayList<>();
        collect(metadata, serviceNames, declaredQueues);
        Set<String> active = new LinkedHashSet<>(activeQueues(candidateQueues(serviceNames, declaredQueues)));

        Map<String, DiscoveredService> merged = new LinkedHashMap<>();
        for (DiscoveredService service : metadata.services()) {
            TemporalStatus status = service.getTaskQueue() != null && active.contains(service.getTaskQueue())
                    ? TemporalStatus.ACTIVE : TemporalStatus.INACTIVE;
            if (status == TemporalStatus.INACTIVE) {
                log.warn("Service {} answered metadata but its task queue {} has no pollers",
                        service.getServiceName(), service.getTaskQueue());
            }
            merged.put(service.getServiceName(), service.withStatus(status));
        }
        ServiceCatalog catalog = new ServiceCatalog(merged, metadata.getDiscoveredAt());
        log.info("Hybrid discovery: {} services, active queues {}", merged.size(), active);
        return catalog;
    }

    private static void collect(ServiceCatalog catalog, List<String> serviceNames, List<String> declaredQueues) {
        for (DiscoveredService s : catalog.services()) {
            serviceNames.add(s.getServiceName());
            if (s.getTaskQueue() != null && !s.getTaskQueue().isBlank()) {
                declaredQueues.add(s.getTaskQueue());
            }
        }
    }

    /**
     * Declared queues first, then naming-convention variants of each service name:
     * {@code {s}-task-queue}, {@code {s with _ as -}-task-queue}, {@code {s}-queue}, {@code {s minus _service}-task-queue}.
     */
    static List<String> candidateQueues(List<String> serviceNames, List<String> declaredQueues) {
        Set<String> candidates = new LinkedHashSet<>(declaredQueues);
        for (String s : serviceNames) {
            if (s == null || s.isBlank()) continue;
            candidates.add(s + "-task-queue");
            candidates.add(s.replace('_', '-') + "-task-queue");
            candidates.add(s + "-queue");
            if (s.endsWith("_service")) {
                candidates.add(s.substring(0, s.length() - "_service".length()) + "-task-queue");
            }
        }
        return new ArrayList<>(candidates);
    }

    private List<String> activeQueues(List<String> candidates) {
        List<String> active = new ArrayList<>();
        for (String queue : candidates) {
            try {
                int pollers = inspector.activityPollerCount(queue);
                if (pollers > 0) {
                    active.add(queue);
                    log.debug("Task queue {} active ({} pollers)", queue, pollers);
                }
            } catch (ControlPlaneUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Describe of task queue {} failed; treating as absent: {}", queue, e.getMessage());
            }
        }
        return active;
    }
}
