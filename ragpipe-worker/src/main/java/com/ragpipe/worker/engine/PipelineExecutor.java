package com.ragpipe.worker.engine;

import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.transform.TransformContext;
import com.ragpipe.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs a pipeline's steps strictly in order: the previous step's output goes through the step's input transform,
 * the resulting argument list is handed to the activity, and the activity's result becomes the next step's data.
 * <p>
 * Configuration errors are thrown before any activity is invoked. Transform and activity failures end the run
 * and are returned as a FAILED {@link PipelineResult}; nothing is retried here, the invoker owns retries.
 * <p>
 * Inside a workflow pass {@code Workflow.getLogger(...)} so replays stay quiet.
 */
public final class PipelineExecutor {

    private final PipelinePlanResolver resolver;
    private final TransformRegistry transforms;
    private final ActivityInvoker invoker;
    private final Logger log;

    public PipelineExecutor(PipelinePlanResolver resolver, TransformRegistry transforms, ActivityInvoker invoker,
                            Logger log) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.transforms = Objects.requireNonNull(transforms, "transforms");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.log = log != null ? log : LoggerFactory.getLogger(PipelineExecutor.class);
    }

    public PipelineExecutor(PipelinePlanResolver resolver, TransformRegistry transforms, ActivityInvoker invoker) {
        this(resolver, transforms, invoker, null);
    }

    /**
     * @param runId workflow id of the run, carried into the result
     * @throws ConfigurationException unknown pipeline or activity, or a pipeline without steps
     */
    public PipelineResult execute(String pipelineName, Object input, String runId) {
        PipelinePlan plan = resolver.resolve(pipelineName);
        if (plan.getSteps().isEmpty()) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_STEP, pipelineName,
                    "Pipeline '" + pipelineName + "' has no steps");
        }
        log.info("Executing pipeline {} ({} steps, {}) run={}", plan.getPipelineName(), plan.getSteps().size(),
                plan.getOrigin(), runId);

        Object currentData = input;
        List<StepTraceEntry> trace = new ArrayList<>();
        for (PipelinePlan.PlannedStep step : plan.getSteps()) {
            ActivityDescriptor activity = step.getActivity();
            List<Object> args;
            try {
                args = transformInput(step.getTransformName(), currentData, step.getStepContext(), input,
                        plan.getDefaultCollection());
            } catch (RuntimeException e) {
                log.error("Transform {} failed before step {} ({}): {}", step.getTransformName(), step.getStepIndex(),
                        activity.getName(), e.getMessage());
                return fail(plan, runId, step, ErrorKind.TRANSFORM_ERROR, e.getMessage(), trace);
            }
            log.info("Step {}: {} ({}{})", step.getStepIndex(), activity.getName(), activity.getKind(),
                    activity.isLocal() ? "" : " on " + activity.getTaskQueue());
            Object result;
            try {
                result = invoker.invoke(activity, args);
            } catch (ActivityInvocationException e) {
                log.error("Step {} ({}) failed: {}", step.getStepIndex(), activity.getName(), e.getMessage());
                return fail(plan, runId, step, ErrorKind.ACTIVITY_EXECUTION_ERROR, e.getMessage(), trace);
            }
            trace.add(StepTraceEntry.completed(step.getStepIndex(), activity.getName(), result));
            currentData = result;
        }
        log.info("Pipeline {} completed: {} steps", plan.getPipelineName(), trace.size());
        return PipelineResult.completed(plan.getPipelineName(), runId, currentData, trace);
    }

    /** Applies one named transform in isolation; unknown names fall back to passthrough. */
    public List<Object> transformInput(String transformName, Object data, Map<String, Object> stepContext,
                                       Object workflowInput, String defaultCollection) {
        return transforms.get(transformName)
                .apply(data, new TransformContext(stepContext, workflowInput, defaultCollection));
    }

    private static PipelineResult fail(PipelinePlan plan, String runId, PipelinePlan.PlannedStep step,
                                       ErrorKind kind, String message, List<StepTraceEntry> trace) {
        String activityName = step.getActivity().getName();
        PipelineFailure failure = new PipelineFailure(plan.getPipelineName(), step.getStepIndex(), activityName,
                kind, message, trace, StepTraceEntry.failed(step.getStepIndex(), activityName, message));
        return PipelineResult.failed(runId, failure);
    }
}
