package com.ragpipe.worker.engine;

/** Why a pipeline run failed. */
public enum ErrorKind {
    /** Unknown pipeline, activity or transform. Raised, never returned in a result. */
    CONFIGURATION_ERROR,
    /** A transform could not normalize the previous step's output. Not retried. */
    TRANSFORM_ERROR,
    /** The activity failed after the host exhausted its retry policy. */
    ACTIVITY_EXECUTION_ERROR
}
