package com.ragpipe.discovery;

import com.ragpipe.config.WorkerEndpoint;
import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.protocol.WorkerMetadataDocument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One service as seen through its worker's metadata endpoint. Immutable. */
public final class DiscoveredService {

    private final String serviceName;
    private final String taskQueue;
    private final String workerIdentity;
    private final String health;
    private final String version;
    private final Map<String, ActivityMetadataDocument> activities;
    private final TemporalStatus temporalStatus;
    private final WorkerEndpoint endpoint;

    public DiscoveredService(String serviceName, String taskQueue, String workerIdentity, String health,
                             String version, Map<String, ActivityMetadataDocument> activities,
                             TemporalStatus temporalStatus, WorkerEndpoint endpoint) {
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.taskQueue = taskQueue;
        this.workerIdentity = workerIdentity;
        this.health = health;
        this.version = version;
        this.activities = Collections.unmodifiableMap(new LinkedHashMap<>(activities));
        this.temporalStatus = temporalStatus != null ? temporalStatus : TemporalStatus.UNKNOWN;
        this.endpoint = endpoint;
    }

    /**
     * Builds a service from a metadata document. The service name falls back to the endpoint's name
     * when the document does not declare one.
     */
    public static DiscoveredService fromMetadata(WorkerMetadataDocument doc, WorkerEndpoint endpoint) {
        Map<String, ActivityMetadataDocument> activities = new LinkedHashMap<>();
        for (ActivityMetadataDocument a : doc.getActivities()) {
            if (a.getName() != null && !a.getName().isBlank()) {
                activities.put(a.getName(), a);
            }
        }
        String name = doc.getServiceName() != null && !doc.getServiceName().isBlank()
                ? doc.getServiceName() : endpoint.getName();
        return new DiscoveredService(name, doc.getTaskQueue(), doc.getWorkerIdentity(), doc.getHealth(),
                doc.getVersion(), activities, TemporalStatus.UNKNOWN, endpoint);
    }

    public DiscoveredService withStatus(TemporalStatus status) {
        return new DiscoveredService(serviceName, taskQueue, workerIdentity, health, version, activities, status, endpoint);
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getTaskQueue() {
        return taskQueue;
    }

    public String getWorkerIdentity() {
        return workerIdentity;
    }

    public String getHealth() {
        return health;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, ActivityMetadataDocument> getActivities() {
        return activities;
    }

    public TemporalStatus getTemporalStatus() {
        return temporalStatus;
    }

    public WorkerEndpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DiscoveredService that = (DiscoveredService) o;
        return serviceName.equals(that.serviceName)
                && Objects.equals(taskQueue, that.taskQueue)
                && Objects.equals(workerIdentity, that.workerIdentity)
                && Objects.equals(health, that.health)
                && Objects.equals(version, that.version)
                && activities.equals(that.activities)
                && temporalStatus == that.temporalStatus
                && Objects.equals(endpoint, that.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceName, taskQueue, workerIdentity, health, version, activities, temporalStatus, endpoint);
    }

    @Override
    public String toString() {
        return serviceName + "{queue=" + taskQueue + ", status=" + temporalStatus + ", activities=" + activities.keySet() + "}";
    }
}
