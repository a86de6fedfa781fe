package com.ragpipe.activity;

import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.protocol.WorkerMetadataDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Activities hosted by one worker, keyed by registered activity name. Each entry carries the function that
 * runs it and the metadata the worker advertises on {@code GET /metadata}. Immutable once built.
 */
public final class ActivityCatalog {

    private final Map<String, ActivityFunction> functions;
    private final Map<String, ActivityMetadataDocument> metadata;

    private ActivityCatalog(Map<String, ActivityFunction> functions, Map<String, ActivityMetadataDocument> metadata) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ActivityFunction> get(String activityName) {
        return Optional.ofNullable(functions.get(activityName));
    }

    public boolean contains(String activityName) {
        return functions.containsKey(activityName);
    }

    public Set<String> names() {
        return functions.keySet();
    }

    public List<ActivityMetadataDocument> metadata() {
        return new ArrayList<>(metadata.values());
    }

    /** The self-description a worker hosting these activities serves to discovery. */
    public WorkerMetadataDocument toMetadataDocument(String serviceName, String taskQueue,
                                                     String workerIdentity, String version) {
        return new WorkerMetadataDocument(serviceName, taskQueue, workerIdentity,
                WorkerMetadataDocument.HEALTH_HEALTHY, version, metadata());
    }

    @Override
    public String toString() {
        return "ActivityCatalog" + functions.keySet();
    }

    public static final class Builder {
        private final Map<String, ActivityFunction> functions = new LinkedHashMap<>();
        private final Map<String, ActivityMetadataDocument> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(ActivityMetadataDocument meta, ActivityFunction function) {
            Objects.requireNonNull(meta, "meta");
            Objects.requireNonNull(function, "function");
            String name = meta.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Activity metadata has no name");
            }
            if (functions.containsKey(name)) {
                throw new IllegalArgumentException("Activity registered twice: " + name);
            }
            functions.put(name, function);
            metadata.put(name, meta);
            return this;
        }

        public ActivityCatalog build() {
            return new ActivityCatalog(functions, metadata);
        }
    }
}
