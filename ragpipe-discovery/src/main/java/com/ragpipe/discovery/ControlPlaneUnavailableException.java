package com.ragpipe.discovery;

/** The Temporal frontend cannot be reached at all (as opposed to one queue failing to describe). */
public class ControlPlaneUnavailableException extends DiscoveryException {

    public ControlPlaneUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
