package com.ragpipe.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragpipe.pipeline.defaults.ActivityDefaults;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything needed to invoke one activity: its name, where it runs (kind, owning service, task queue),
 * its per-attempt timeout and retry policy. A REMOTE descriptor always has a task queue; a LOCAL one runs
 * on the orchestrator's own queue and has none.
 */
public final class ActivityDescriptor {

    private final String name;
    private final ExecutionKind kind;
    private final String service;
    private final String taskQueue;
    private final long timeoutSeconds;
    private final RetryPolicySpec retryPolicy;

    @JsonCreator
    public ActivityDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("kind") ExecutionKind kind,
            @JsonProperty("service") String service,
            @JsonProperty("taskQueue") String taskQueue,
            @JsonProperty("timeoutSeconds") Long timeoutSeconds,
            @JsonProperty("retryPolicy") RetryPolicySpec retryPolicy) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind != null ? kind : ExecutionKind.REMOTE;
        this.service = service;
        this.taskQueue = taskQueue;
        this.timeoutSeconds = timeoutSeconds != null && timeoutSeconds > 0
                ? timeoutSeconds : ActivityDefaults.TIMEOUT_MINUTES * 60L;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicySpec.DEFAULT;
        if (this.kind == ExecutionKind.REMOTE && (taskQueue == null || taskQueue.isBlank())) {
            throw new IllegalArgumentException("Remote activity " + name + " has no task queue");
        }
    }

    public static ActivityDescriptor local(String name, Duration timeout, RetryPolicySpec retryPolicy) {
        return new ActivityDescriptor(name, ExecutionKind.LOCAL, ActivityDefaults.LOCAL_SERVICE, null,
                timeout != null ? timeout.getSeconds() : null, retryPolicy);
    }

    public static ActivityDescriptor remote(String name, String service, String taskQueue,
                                            Duration timeout, RetryPolicySpec retryPolicy) {
        return new ActivityDescriptor(name, ExecutionKind.REMOTE, service, taskQueue,
                timeout != null ? timeout.getSeconds() : null, retryPolicy);
    }

    public String getName() {
        return name;
    }

    public ExecutionKind getKind() {
        return kind;
    }

    public String getService() {
        return service;
    }

    /** Task queue of the owning service; null for LOCAL activities. */
    public String getTaskQueue() {
        return taskQueue;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public RetryPolicySpec getRetryPolicy() {
        return retryPolicy;
    }

    @JsonIgnore
    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    @JsonIgnore
    public boolean isLocal() {
        return kind == ExecutionKind.LOCAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActivityDescriptor that = (ActivityDescriptor) o;
        return timeoutSeconds == that.timeoutSeconds
                && name.equals(that.name)
                && kind == that.kind
                && Objects.equals(service, that.service)
                && Objects.equals(taskQueue, that.taskQueue)
                && retryPolicy.equals(that.retryPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind, service, taskQueue, timeoutSeconds, retryPolicy);
    }

    @Override
    public String toString() {
        return "ActivityDescriptor{" + name + ", " + kind + ", service=" + service
                + (taskQueue != null ? ", queue=" + taskQueue : "") + ", timeout=" + timeoutSeconds + "s}";
    }
}
