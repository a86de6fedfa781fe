package com.ragpipe.worker.activity;

import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.worker.engine.PipelinePlan;
import com.ragpipe.worker.engine.PipelinePlanResolver;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class PipelineActivitiesImpl implements PipelineActivities {

    private static final Logger log = LoggerFactory.getLogger(PipelineActivitiesImpl.class);

    private final PipelinePlanResolver resolver;

    public PipelineActivitiesImpl(PipelinePlanResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public String resolvePlan(String pipelineName) {
        try {
            PipelinePlan plan = resolver.resolve(pipelineName);
            log.info("Resolved pipeline {} ({} steps, {})", pipelineName, plan.getSteps().size(), plan.getOrigin());
            return plan.toJson();
        } catch (ConfigurationException e) {
            log.error("Cannot resolve pipeline {}: {}", pipelineName, e.getMessage());
            throw ApplicationFailure.newNonRetryableFailure(e.getMessage(), CONFIGURATION_ERROR,
                    e.getKind().name(), e.getSubject());
        }
    }
}
