package com.ragpipe.worker.activity;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/** Orchestrator-side activities backing {@code GenericPipelineWorkflow}. */
@ActivityInterface
public interface PipelineActivities {

    /** Failure type of a non-retryable configuration error; details are the error kind and its subject. */
    String CONFIGURATION_ERROR = "ConfigurationError";

    /**
     * Resolves the pipeline against the worker's current configuration.
     *
     * @return plan JSON ({@code PipelinePlan})
     */
    @ActivityMethod
    String resolvePlan(String pipelineName);
}
