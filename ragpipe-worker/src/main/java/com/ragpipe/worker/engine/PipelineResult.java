package com.ragpipe.worker.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one pipeline run. On success {@code finalResult} is the last step's output; on failure it is null
 * and {@code failure} explains what happened.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PipelineResult {

    private final String pipelineName;
    private final String workflowId;
    private final PipelineStatus status;
    private final Object finalResult;
    private final int stepsCompleted;
    private final List<StepTraceEntry> stepTrace;
    private final PipelineFailure failure;

    @JsonCreator
    public PipelineResult(
            @JsonProperty("pipelineName") String pipelineName,
            @JsonProperty("workflowId") String workflowId,
            @JsonProperty("status") PipelineStatus status,
            @JsonProperty("finalResult") Object finalResult,
            @JsonProperty("stepsCompleted") int stepsCompleted,
            @JsonProperty("stepTrace") List<StepTraceEntry> stepTrace,
            @JsonProperty("failure") PipelineFailure failure) {
        this.pipelineName = pipelineName;
        this.workflowId = workflowId;
        this.status = status;
        this.finalResult = finalResult;
        this.stepsCompleted = stepsCompleted;
        this.stepTrace = stepTrace != null ? List.copyOf(stepTrace) : List.of();
        this.failure = failure;
    }

    public static PipelineResult completed(String pipelineName, String workflowId, Object finalResult,
                                           List<StepTraceEntry> trace) {
        return new PipelineResult(pipelineName, workflowId, PipelineStatus.COMPLETED, finalResult,
                trace.size(), trace, null);
    }

    public static PipelineResult failed(String workflowId, PipelineFailure failure) {
        return new PipelineResult(failure.getPipelineName(), workflowId, PipelineStatus.FAILED, null,
                failure.getStepTrace().size(), failure.getStepTrace(), failure);
    }

    public String getPipelineName() {
        return pipelineName;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public PipelineStatus getStatus() {
        return status;
    }

    public Object getFinalResult() {
        return finalResult;
    }

    public int getStepsCompleted() {
        return stepsCompleted;
    }

    public List<StepTraceEntry> getStepTrace() {
        return stepTrace;
    }

    public PipelineFailure getFailure() {
        return failure;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == PipelineStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "PipelineResult{" + pipelineName + " " + status + ", steps=" + stepsCompleted
                + (failure != null ? ", " + failure : "") + "}";
    }
}
