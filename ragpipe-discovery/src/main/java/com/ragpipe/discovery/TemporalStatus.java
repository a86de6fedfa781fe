package com.ragpipe.discovery;

/**
 * Whether a discovered service's task queue currently has pollers.
 * {@link #UNKNOWN} until the metadata has been cross-referenced with the control plane.
 */
public enum TemporalStatus {
    ACTIVE,
    INACTIVE,
    UNKNOWN
}
