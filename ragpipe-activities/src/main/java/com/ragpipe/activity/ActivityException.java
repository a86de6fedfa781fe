package com.ragpipe.activity;

/** An activity body failed. The message carries the activity-specific context; the cause is kept. */
public class ActivityException extends RuntimeException {

    public ActivityException(String message) {
        super(message);
    }

    public ActivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
