package com.ragpipe.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only context handed to a {@link Transform}: the step being prepared (activity, transform, type, service),
 * the original workflow input and the executor's default vector collection.
 */
public final class TransformContext {

    private final Map<String, Object> stepContext;
    private final Object workflowInput;
    private final String defaultCollection;

    public TransformContext(Map<String, Object> stepContext, Object workflowInput, String defaultCollection) {
        this.stepContext = stepContext != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(stepContext))
                : Map.of();
        this.workflowInput = workflowInput;
        this.defaultCollection = Objects.requireNonNull(defaultCollection, "defaultCollection");
    }

    public static TransformContext of(Object workflowInput, String defaultCollection) {
        return new TransformContext(null, workflowInput, defaultCollection);
    }

    public Map<String, Object> getStepContext() {
        return stepContext;
    }

    public Object getWorkflowInput() {
        return workflowInput;
    }

    public String getDefaultCollection() {
        return defaultCollection;
    }

    /**
     * Collection named by the workflow input ({@code collection} key when the input is a map),
     * otherwise the default collection.
     */
    public String collectionFromWorkflowInput() {
        if (workflowInput instanceof Map) {
            Object c = ((Map<?, ?>) workflowInput).get("collection");
            if (c != null) return c.toString();
        }
        return defaultCollection;
    }
}
