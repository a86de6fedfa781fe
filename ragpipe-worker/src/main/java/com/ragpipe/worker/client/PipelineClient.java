package com.ragpipe.worker.client;

import com.ragpipe.worker.engine.PipelineResult;
import com.ragpipe.worker.workflow.GenericPipelineWorkflow;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Starts {@link GenericPipelineWorkflow} runs on the orchestrator task queue.
 * Workflow ids are {@code <pipeline>-<uuid>}.
 */
public final class PipelineClient {

    private final WorkflowClient client;
    private final String taskQueue;
    private final Duration executionTimeout;

    /**
     * @param executionTimeout whole-run limit, or null for none
     */
    public PipelineClient(WorkflowClient client, String taskQueue, Duration executionTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
        this.executionTimeout = executionTimeout;
    }

    /** Runs the pipeline and blocks until it finishes. */
    public PipelineResult run(String pipelineName, Object input) {
        return newStub(pipelineName).run(pipelineName, input);
    }

    /** Starts the pipeline and returns its execution without waiting. */
    public WorkflowExecution start(String pipelineName, Object input) {
        GenericPipelineWorkflow stub = newStub(pipelineName);
        return WorkflowClient.start(stub::run, pipelineName, input);
    }

    private GenericPipelineWorkflow newStub(String pipelineName) {
        WorkflowOptions.Builder options = WorkflowOptions.newBuilder()
                .setTaskQueue(taskQueue)
                .setWorkflowId(pipelineName + "-" + UUID.randomUUID());
        if (executionTimeout != null) {
            options.setWorkflowExecutionTimeout(executionTimeout);
        }
        return client.newWorkflowStub(GenericPipelineWorkflow.class, options.build());
    }
}
