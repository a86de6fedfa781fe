package com.ragpipe.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable table of activity descriptors and pipeline definitions. Replaced wholesale on reload,
 * never mutated, so concurrent pipeline runs can read it without locking.
 */
public final class ServiceConfig {

    private final Map<String, ActivityDescriptor> activities;
    private final Map<String, PipelineDefinition> pipelines;
    private final String source;

    private ServiceConfig(Map<String, ActivityDescriptor> activities,
                          Map<String, PipelineDefinition> pipelines,
                          String source) {
        this.activities = Collections.unmodifiableMap(new LinkedHashMap<>(activities));
        this.pipelines = Collections.unmodifiableMap(new LinkedHashMap<>(pipelines));
        this.source = source != null ? source : "unknown";
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    public Optional<ActivityDescriptor> getActivityDescriptor(String name) {
        return Optional.ofNullable(name != null ? activities.get(name) : null);
    }

    public Optional<PipelineDefinition> getPipelineDefinition(String name) {
        return Optional.ofNullable(name != null ? pipelines.get(name) : null);
    }

    /** @throws ConfigurationException with kind ACTIVITY_NOT_FOUND */
    public ActivityDescriptor requireActivity(String name) {
        return getActivityDescriptor(name).orElseThrow(() -> ConfigurationException.activityNotFound(name));
    }

    /** @throws ConfigurationException with kind PIPELINE_NOT_FOUND */
    public PipelineDefinition requirePipeline(String name) {
        return getPipelineDefinition(name).orElseThrow(() -> ConfigurationException.pipelineNotFound(name));
    }

    public Map<String, ActivityDescriptor> getActivities() {
        return activities;
    }

    public Map<String, PipelineDefinition> getPipelines() {
        return pipelines;
    }

    public List<String> localActivityNames() {
        return activities.values().stream()
                .filter(ActivityDescriptor::isLocal)
                .map(ActivityDescriptor::getName)
                .collect(Collectors.toList());
    }

    /** Where this table came from (file path, classpath resource or discovery). */
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return "ServiceConfig{source=" + source + ", activities=" + activities.keySet()
                + ", pipelines=" + pipelines.keySet() + "}";
    }

    public static final class Builder {
        private final String source;
        private final Map<String, ActivityDescriptor> activities = new LinkedHashMap<>();
        private final Map<String, PipelineDefinition> pipelines = new LinkedHashMap<>();

        private Builder(String source) {
            this.source = source;
        }

        /**
         * @throws ConfigurationException (INVALID_DOCUMENT) if another service already declared the name
         */
        public Builder activity(ActivityDescriptor descriptor) {
            ActivityDescriptor existing = activities.get(descriptor.getName());
            if (existing != null) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, descriptor.getName(),
                        "Activity '" + descriptor.getName() + "' is declared by both service '" + existing.getService()
                                + "' and service '" + descriptor.getService() + "' in " + source);
            }
            activities.put(descriptor.getName(), descriptor);
            return this;
        }

        /** Adds a pipeline; a later pipeline with the same name replaces the earlier one. */
        public Builder pipeline(PipelineDefinition definition) {
            pipelines.put(definition.getName(), definition);
            return this;
        }

        public boolean hasPipeline(String name) {
            return pipelines.containsKey(name);
        }

        public boolean hasActivity(String name) {
            return activities.containsKey(name);
        }

        public ServiceConfig build() {
            return new ServiceConfig(activities, pipelines, source);
        }
    }
}
