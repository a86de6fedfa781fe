package com.ragpipe.transform;

import java.util.List;

/**
 * Normalizes the previous step's raw output into the positional argument list of the next activity.
 * Implementations are pure and stateless, so one instance is shared across concurrent pipeline runs.
 */
@FunctionalInterface
public interface Transform {

    /**
     * @param data    previous step's result (or the workflow input for the first step); may be null
     * @param context step being prepared, original workflow input and default collection
     * @return positional arguments for the step's activity; never null
     * @throws TransformException if the data cannot be normalized
     */
    List<Object> apply(Object data, TransformContext context);
}
