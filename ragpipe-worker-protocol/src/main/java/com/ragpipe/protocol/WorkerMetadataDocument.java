package com.ragpipe.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * Body of a worker's {@code GET /metadata} response: the service it belongs to, the task queue it polls
 * and the activities it can run. Written by service workers, read by discovery.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkerMetadataDocument {

    public static final String HEALTH_HEALTHY = "healthy";
    public static final String HEALTH_DEGRADED = "degraded";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String serviceName;
    private final String taskQueue;
    private final String workerIdentity;
    private final String health;
    private final String version;
    private final List<ActivityMetadataDocument> activities;

    @JsonCreator
    public WorkerMetadataDocument(
            @JsonProperty("service_name") String serviceName,
            @JsonProperty("task_queue") String taskQueue,
            @JsonProperty("worker_identity") String workerIdentity,
            @JsonProperty("health") String health,
            @JsonProperty("version") String version,
            @JsonProperty("activities") List<ActivityMetadataDocument> activities) {
        this.serviceName = serviceName;
        this.taskQueue = taskQueue;
        this.workerIdentity = workerIdentity;
        this.health = health != null ? health : HEALTH_HEALTHY;
        this.version = version;
        this.activities = activities != null ? List.copyOf(activities) : null;
    }

    /** Parses a metadata body. */
    public static WorkerMetadataDocument fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, WorkerMetadataDocument.class);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize worker metadata for " + serviceName, e);
        }
    }

    @JsonProperty("service_name")
    public String getServiceName() {
        return serviceName;
    }

    @JsonProperty("task_queue")
    public String getTaskQueue() {
        return taskQueue;
    }

    @JsonProperty("worker_identity")
    public String getWorkerIdentity() {
        return workerIdentity;
    }

    @JsonProperty("health")
    public String getHealth() {
        return health;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    /** Declared activities; null when the body had no {@code activities} key (not a worker metadata document). */
    @JsonProperty("activities")
    public List<ActivityMetadataDocument> getActivities() {
        return activities;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerMetadataDocument that = (WorkerMetadataDocument) o;
        return Objects.equals(serviceName, that.serviceName)
                && Objects.equals(taskQueue, that.taskQueue)
                && Objects.equals(workerIdentity, that.workerIdentity)
                && Objects.equals(health, that.health)
                && Objects.equals(version, that.version)
                && Objects.equals(activities, that.activities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceName, taskQueue, workerIdentity, health, version, activities);
    }
}
