package com.ragpipe.worker.engine;

/** Final failure of one activity invocation, after the host's retries. */
public class ActivityInvocationException extends RuntimeException {

    private final String activityName;

    public ActivityInvocationException(String activityName, String message, Throwable cause) {
        super(message, cause);
        this.activityName = activityName;
    }

    public String getActivityName() {
        return activityName;
    }
}
