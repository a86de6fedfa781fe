package com.ragpipe.worker.workflow;

import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.transform.TransformRegistry;
import com.ragpipe.worker.activity.PipelineActivities;
import com.ragpipe.worker.engine.PipelineExecutor;
import com.ragpipe.worker.engine.PipelineResult;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ApplicationFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * Resolves the plan through an activity, then walks it with {@link PipelineExecutor}, scheduling one Temporal
 * activity per step. Configuration errors fail the workflow without retry.
 */
public class GenericPipelineWorkflowImpl implements GenericPipelineWorkflow {

    private static final Logger log = Workflow.getLogger(GenericPipelineWorkflowImpl.class);
    private static final Duration RESOLVE_TIMEOUT = Duration.ofSeconds(30);

    @Override
    public PipelineResult run(String pipelineName, Object input) {
        PipelineActivities activities = Workflow.newActivityStub(
                PipelineActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(RESOLVE_TIMEOUT)
                        .setRetryOptions(RetryOptions.newBuilder().setMaximumAttempts(3).build())
                        .build());
        PipelineExecutor executor = new PipelineExecutor(
                new ActivityPlanResolver(activities),
                TransformRegistry.defaultRegistry(),
                new TemporalActivityInvoker(),
                Workflow.getLogger(PipelineExecutor.class));
        String workflowId = Workflow.getInfo().getWorkflowId();
        try {
            return executor.execute(pipelineName, input, workflowId);
        } catch (ConfigurationException e) {
            log.error("Pipeline {} cannot run: {}", pipelineName, e.getMessage());
            throw ApplicationFailure.newNonRetryableFailure(e.getMessage(), PipelineActivities.CONFIGURATION_ERROR,
                    e.getKind().name(), e.getSubject());
        }
    }
}
