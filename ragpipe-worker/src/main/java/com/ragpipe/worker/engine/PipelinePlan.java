package com.ragpipe.worker.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.PipelineOrigin;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A pipeline with every step resolved to its activity descriptor. Built outside the workflow and passed in as
 * JSON so the workflow replays against the plan it started with, not against whatever configuration is current.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelinePlan {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String pipelineName;
    private final PipelineOrigin origin;
    private final String defaultCollection;
    private final List<PlannedStep> steps;

    @JsonCreator
    public PipelinePlan(
            @JsonProperty("pipelineName") String pipelineName,
            @JsonProperty("origin") PipelineOrigin origin,
            @JsonProperty("defaultCollection") String defaultCollection,
            @JsonProperty("steps") List<PlannedStep> steps) {
        this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
        this.origin = origin != null ? origin : PipelineOrigin.DECLARED;
        this.defaultCollection = defaultCollection;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static PipelinePlan fromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelinePlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid pipeline plan JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize plan for " + pipelineName, e);
        }
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public PipelineOrigin getOrigin() {
        return origin;
    }

    public String getDefaultCollection() {
        return defaultCollection;
    }

    public List<PlannedStep> getSteps() {
        return steps;
    }

    /** One resolved step. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PlannedStep {
        private final int stepIndex;
        private final ActivityDescriptor activity;
        private final String transformName;
        private final Map<String, Object> stepContext;

        @JsonCreator
        public PlannedStep(
                @JsonProperty("stepIndex") int stepIndex,
                @JsonProperty("activity") ActivityDescriptor activity,
                @JsonProperty("transformName") String transformName,
                @JsonProperty("stepContext") Map<String, Object> stepContext) {
            this.stepIndex = stepIndex;
            this.activity = Objects.requireNonNull(activity, "activity");
            this.transformName = transformName;
            this.stepContext = stepContext != null ? stepContext : Map.of();
        }

        public int getStepIndex() {
            return stepIndex;
        }

        public ActivityDescriptor getActivity() {
            return activity;
        }

        public String getTransformName() {
            return transformName;
        }

        public Map<String, Object> getStepContext() {
            return stepContext;
        }
    }
}
