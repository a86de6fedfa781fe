package com.ragpipe.worker.engine;

import com.ragpipe.pipeline.ActivityDescriptor;

import java.util.List;

/**
 * Invokes one activity with positional arguments under the descriptor's placement, timeout and retry policy.
 * Retries are the invoker's business; the caller only sees the final outcome.
 */
public interface ActivityInvoker {

    /**
     * @return the activity's result
     * @throws ActivityInvocationException when the activity failed terminally
     */
    Object invoke(ActivityDescriptor descriptor, List<Object> args);
}
