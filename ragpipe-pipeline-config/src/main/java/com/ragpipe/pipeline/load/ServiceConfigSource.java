package com.ragpipe.pipeline.load;

import com.ragpipe.pipeline.ServiceConfig;

/** Produces a complete, validated {@link ServiceConfig}: from a static document or from runtime discovery. */
public interface ServiceConfigSource {

    /**
     * @throws com.ragpipe.pipeline.ConfigurationException if the produced table is invalid
     * @throws RuntimeException if the source itself cannot be reached
     */
    ServiceConfig load();

    /** Human-readable origin, used in log lines. */
    String describe();
}
