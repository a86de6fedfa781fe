package com.ragpipe.pipeline;

/** Whether a pipeline was written in configuration or guessed from discovered activity names. */
public enum PipelineOrigin {
    DECLARED,
    INFERRED
}
