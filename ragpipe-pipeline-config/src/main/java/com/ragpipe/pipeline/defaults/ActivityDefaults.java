package com.ragpipe.pipeline.defaults;

/** Defaults applied when an activity entry omits timeout or retry settings. */
public final class ActivityDefaults {

    public static final int TIMEOUT_MINUTES = 5;
    public static final int RETRY_INITIAL_INTERVAL_SECONDS = 1;
    public static final int RETRY_MAXIMUM_INTERVAL_SECONDS = 30;
    public static final int RETRY_MAXIMUM_ATTEMPTS = 3;
    public static final double RETRY_BACKOFF_COEFFICIENT = 2.0;

    /** Service name reported for activities from the {@code local_activities} section. */
    public static final String LOCAL_SERVICE = "local";
    public static final String LOCAL_ACTIVITIES_SECTION = "local_activities";
    public static final String DEFAULT_TRANSFORM = "passthrough";

    private ActivityDefaults() {
    }
}
