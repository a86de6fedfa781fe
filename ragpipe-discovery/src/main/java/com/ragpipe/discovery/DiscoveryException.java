package com.ragpipe.discovery;

/** Discovery as a whole failed. Surfaced to whoever triggered the refresh; in-flight runs keep their config. */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
