package com.ragpipe.pipeline;

/**
 * Configuration is unusable: an unknown pipeline, activity or transform, or a malformed document.
 * Fatal and never retried.
 */
public class ConfigurationException extends RuntimeException {

    public enum Kind {
        PIPELINE_NOT_FOUND,
        ACTIVITY_NOT_FOUND,
        UNKNOWN_TRANSFORM,
        INVALID_DOCUMENT,
        INVALID_STEP
    }

    private final Kind kind;
    private final String subject;

    public ConfigurationException(Kind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public ConfigurationException(Kind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public static ConfigurationException pipelineNotFound(String pipelineName) {
        return new ConfigurationException(Kind.PIPELINE_NOT_FOUND, pipelineName,
                "Pipeline '" + pipelineName + "' not found in configuration");
    }

    public static ConfigurationException activityNotFound(String activityName) {
        return new ConfigurationException(Kind.ACTIVITY_NOT_FOUND, activityName,
                "Activity '" + activityName + "' not found in configuration");
    }

    public Kind getKind() {
        return kind;
    }

    /** Name of the pipeline, activity, transform or document the error is about. */
    public String getSubject() {
        return subject;
    }
}
