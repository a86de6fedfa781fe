package com.ragpipe.worker.engine;

public enum PipelineStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
