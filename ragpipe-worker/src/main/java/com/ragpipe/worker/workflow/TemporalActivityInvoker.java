package com.ragpipe.worker.workflow;

import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.RetryPolicySpec;
import com.ragpipe.worker.engine.ActivityInvocationException;
import com.ragpipe.worker.engine.ActivityInvoker;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.ActivityStub;
import io.temporal.workflow.Workflow;

import java.util.List;

/**
 * {@link ActivityInvoker} for workflow code: one untyped activity stub per invocation, scheduled by activity name.
 * REMOTE activities go to their service's task queue; LOCAL ones stay on the workflow's own queue, where the
 * worker's dispatcher runs them in-process. Temporal applies the descriptor's timeout and retry policy.
 */
public final class TemporalActivityInvoker implements ActivityInvoker {

    @Override
    public Object invoke(ActivityDescriptor descriptor, List<Object> args) {
        ActivityStub stub = Workflow.newUntypedActivityStub(activityOptions(descriptor));
        try {
            return stub.execute(descriptor.getName(), Object.class, args.toArray());
        } catch (ActivityFailure e) {
            throw new ActivityInvocationException(descriptor.getName(), describe(e), e);
        }
    }

    static ActivityOptions activityOptions(ActivityDescriptor descriptor) {
        RetryPolicySpec retry = descriptor.getRetryPolicy();
        ActivityOptions.Builder options = ActivityOptions.newBuilder()
                .setStartToCloseTimeout(descriptor.timeout())
                .setRetryOptions(RetryOptions.newBuilder()
                        .setInitialInterval(retry.initialInterval())
                        .setMaximumInterval(retry.maximumInterval())
                        .setBackoffCoefficient(retry.getBackoffCoefficient())
                        .setMaximumAttempts(retry.getMaximumAttempts())
                        .build());
        if (!descriptor.isLocal()) {
            options.setTaskQueue(descriptor.getTaskQueue());
        }
        return options.build();
    }

    static String describe(ActivityFailure failure) {
        Throwable cause = failure.getCause();
        if (cause instanceof ApplicationFailure) {
            ApplicationFailure app = (ApplicationFailure) cause;
            return app.getOriginalMessage() + " (" + app.getType() + ")";
        }
        if (cause instanceof TimeoutFailure) {
            return "Activity timed out: " + ((TimeoutFailure) cause).getTimeoutType();
        }
        return cause != null ? cause.getMessage() : failure.getMessage();
    }
}
