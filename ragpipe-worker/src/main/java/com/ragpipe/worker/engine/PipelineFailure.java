package com.ragpipe.worker.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic for a failed run. {@code stepTrace} holds only the steps that completed; the failing step is
 * described by {@code failedAtStep}, {@code activityName} and {@code failedStep}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineFailure {

    private final String pipelineName;
    private final int failedAtStep;
    private final String activityName;
    private final ErrorKind errorKind;
    private final String message;
    private final List<StepTraceEntry> stepTrace;
    private final StepTraceEntry failedStep;

    @JsonCreator
    public PipelineFailure(
            @JsonProperty("pipelineName") String pipelineName,
            @JsonProperty("failedAtStep") int failedAtStep,
            @JsonProperty("activityName") String activityName,
            @JsonProperty("errorKind") ErrorKind errorKind,
            @JsonProperty("message") String message,
            @JsonProperty("stepTrace") List<StepTraceEntry> stepTrace,
            @JsonProperty("failedStep") StepTraceEntry failedStep) {
        this.pipelineName = pipelineName;
        this.failedAtStep = failedAtStep;
        this.activityName = activityName;
        this.errorKind = errorKind;
        this.message = message;
        this.stepTrace = stepTrace != null ? List.copyOf(stepTrace) : List.of();
        this.failedStep = failedStep;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public int getFailedAtStep() {
        return failedAtStep;
    }

    public String getActivityName() {
        return activityName;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public List<StepTraceEntry> getStepTrace() {
        return stepTrace;
    }

    public StepTraceEntry getFailedStep() {
        return failedStep;
    }

    @Override
    public String toString() {
        return "PipelineFailure{" + pipelineName + " step " + failedAtStep + " (" + activityName + "): "
                + errorKind + " " + message + "}";
    }
}
