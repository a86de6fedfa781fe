package com.ragpipe.worker.workflow;

import com.ragpipe.worker.engine.PipelineResult;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Runs a named pipeline from the service configuration.
 */
@WorkflowInterface
public interface GenericPipelineWorkflow {

    /**
     * @param pipelineName pipeline to run, e.g. {@code document_processing}
     * @param input        first step's data; any JSON value
     * @return completed or failed result; configuration errors fail the workflow with type {@code ConfigurationError}
     */
    @WorkflowMethod
    PipelineResult run(String pipelineName, Object input);
}
