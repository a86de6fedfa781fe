package com.ragpipe.transform;

/**
 * Thrown when a transform receives data it cannot normalize. Retrying does not change the data,
 * so the pipeline run fails immediately with a transform error.
 */
public class TransformException extends RuntimeException {

    private final String transformName;

    public TransformException(String transformName, String message) {
        super(message);
        this.transformName = transformName;
    }

    public TransformException(String transformName, String message, Throwable cause) {
        super(message, cause);
        this.transformName = transformName;
    }

    public String getTransformName() {
        return transformName;
    }
}
