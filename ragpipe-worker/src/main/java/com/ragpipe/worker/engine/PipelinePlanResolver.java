package com.ragpipe.worker.engine;

/** Resolves a pipeline name into a fully resolved plan. */
public interface PipelinePlanResolver {

    /** @throws com.ragpipe.pipeline.ConfigurationException for an unknown pipeline or activity */
    PipelinePlan resolve(String pipelineName);
}
