package com.ragpipe.worker.engine;

public enum StepStatus {
    COMPLETED,
    FAILED
}
