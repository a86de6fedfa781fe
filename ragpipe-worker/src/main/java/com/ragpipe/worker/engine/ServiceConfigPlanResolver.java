package com.ragpipe.worker.engine;

import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.ServiceConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves plans against the current {@link ServiceConfig}. Every step is resolved before the plan is returned,
 * so a missing activity fails the run before anything is invoked.
 */
public final class ServiceConfigPlanResolver implements PipelinePlanResolver {

    private final Supplier<ServiceConfig> config;
    private final String defaultCollection;

    public ServiceConfigPlanResolver(Supplier<ServiceConfig> config, String defaultCollection) {
        this.config = Objects.requireNonNull(config, "config");
        this.defaultCollection = defaultCollection;
    }

    @Override
    public PipelinePlan resolve(String pipelineName) {
        ServiceConfig current = config.get();
        PipelineDefinition definition = current.requirePipeline(pipelineName);
        List<PipelinePlan.PlannedStep> steps = new ArrayList<>(definition.getSteps().size());
        for (int i = 0; i < definition.getSteps().size(); i++) {
            PipelineStep step = definition.getSteps().get(i);
            ActivityDescriptor descriptor = current.requireActivity(step.getActivityName());
            steps.add(new PipelinePlan.PlannedStep(i, descriptor, step.getTransformName(), step.toContext()));
        }
        return new PipelinePlan(definition.getName(), definition.getOrigin(), defaultCollection, steps);
    }
}
