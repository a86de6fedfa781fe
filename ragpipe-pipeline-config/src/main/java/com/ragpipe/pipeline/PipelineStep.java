package com.ragpipe.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragpipe.pipeline.defaults.ActivityDefaults;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a pipeline: the activity to call and the transform that prepares its arguments.
 * {@code declaredKind} and {@code declaredService} are what the document claims; load-time validation checks
 * them against the resolved descriptor.
 */
public final class PipelineStep {

    private final String activityName;
    private final String transformName;
    private final ExecutionKind declaredKind;
    private final String declaredService;

    @JsonCreator
    public PipelineStep(
            @JsonProperty("activityName") String activityName,
            @JsonProperty("transformName") String transformName,
            @JsonProperty("declaredKind") ExecutionKind declaredKind,
            @JsonProperty("declaredService") String declaredService) {
        this.activityName = Objects.requireNonNull(activityName, "activityName");
        this.transformName = transformName != null && !transformName.isBlank()
                ? transformName : ActivityDefaults.DEFAULT_TRANSFORM;
        this.declaredKind = declaredKind;
        this.declaredService = declaredService;
    }

    public static PipelineStep of(String activityName, String transformName) {
        return new PipelineStep(activityName, transformName, null, null);
    }

    public String getActivityName() {
        return activityName;
    }

    public String getTransformName() {
        return transformName;
    }

    public ExecutionKind getDeclaredKind() {
        return declaredKind;
    }

    public String getDeclaredService() {
        return declaredService;
    }

    /** Step as a map, in the shape transforms receive as step context. */
    public Map<String, Object> toContext() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("activity", activityName);
        m.put("input_transform", transformName);
        if (declaredKind != null) m.put("type", declaredKind.toValue());
        if (declaredService != null) m.put("service", declaredService);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineStep that = (PipelineStep) o;
        return activityName.equals(that.activityName)
                && transformName.equals(that.transformName)
                && declaredKind == that.declaredKind
                && Objects.equals(declaredService, that.declaredService);
    }

    @Override
    public int hashCode() {
        return Objects.hash(activityName, transformName, declaredKind, declaredService);
    }

    @Override
    public String toString() {
        return activityName + "(" + transformName + ")";
    }
}
