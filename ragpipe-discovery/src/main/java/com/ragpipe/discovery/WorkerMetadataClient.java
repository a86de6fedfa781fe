package com.ragpipe.discovery;

import com.ragpipe.config.WorkerEndpoint;
import com.ragpipe.protocol.WorkerMetadataDocument;

import java.util.Optional;

/** Fetches a worker's self-description. */
public interface WorkerMetadataClient {

    /**
     * @return the metadata document, or empty if the worker did not answer with a usable one
     *         (connection error, timeout, non-200, malformed body, no {@code activities})
     */
    Optional<WorkerMetadataDocument> fetch(WorkerEndpoint endpoint);
}
