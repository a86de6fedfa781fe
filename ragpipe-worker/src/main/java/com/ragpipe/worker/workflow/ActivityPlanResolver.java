package com.ragpipe.worker.workflow;

import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.worker.activity.PipelineActivities;
import com.ragpipe.worker.engine.PipelinePlan;
import com.ragpipe.worker.engine.PipelinePlanResolver;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;

/**
 * Resolves plans through the {@link PipelineActivities#resolvePlan} activity so the plan is recorded in workflow
 * history. A configuration failure reported by the activity comes back as a {@link ConfigurationException}.
 */
final class ActivityPlanResolver implements PipelinePlanResolver {

    private final PipelineActivities activities;

    ActivityPlanResolver(PipelineActivities activities) {
        this.activities = activities;
    }

    @Override
    public PipelinePlan resolve(String pipelineName) {
        try {
            return PipelinePlan.fromJson(activities.resolvePlan(pipelineName));
        } catch (ActivityFailure e) {
            if (e.getCause() instanceof ApplicationFailure) {
                ApplicationFailure app = (ApplicationFailure) e.getCause();
                if (PipelineActivities.CONFIGURATION_ERROR.equals(app.getType())) {
                    throw toConfigurationException(app, pipelineName);
                }
            }
            throw e;
        }
    }

    static ConfigurationException toConfigurationException(ApplicationFailure failure, String pipelineName) {
        ConfigurationException.Kind kind = ConfigurationException.Kind.PIPELINE_NOT_FOUND;
        String subject = pipelineName;
        if (failure.getDetails().getSize() >= 2) {
            kind = ConfigurationException.Kind.valueOf(failure.getDetails().get(0, String.class));
            subject = failure.getDetails().get(1, String.class);
        }
        return new ConfigurationException(kind, subject, failure.getOriginalMessage(), failure);
    }
}
