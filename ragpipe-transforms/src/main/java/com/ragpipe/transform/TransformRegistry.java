package com.ragpipe.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable name to {@link Transform} table. Lookup of an unknown name yields passthrough;
 * callers that must reject unknown names check {@link #contains(String)} first.
 */
public final class TransformRegistry {

    private final Map<String, Transform> transforms;
    private final Transform fallback;

    private TransformRegistry(Map<String, Transform> transforms) {
        this.transforms = Collections.unmodifiableMap(new LinkedHashMap<>(transforms));
        this.fallback = transforms.get(PassthroughTransform.NAME);
    }

    /** Registry with the four built-in transforms. */
    public static TransformRegistry defaultRegistry() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Transform get(String name) {
        if (name == null) return fallback;
        Transform t = transforms.get(name);
        return t != null ? t : fallback;
    }

    public boolean contains(String name) {
        return name != null && transforms.containsKey(name);
    }

    public Set<String> names() {
        return transforms.keySet();
    }

    public static final class Builder {
        private final Map<String, Transform> transforms = new LinkedHashMap<>();

        private Builder() {
            transforms.put(QueryWithCollectionTransform.NAME, new QueryWithCollectionTransform());
            transforms.put(DocumentsTransform.NAME, new DocumentsTransform());
            transforms.put(ChunkedDocsWithCollectionTransform.NAME, new ChunkedDocsWithCollectionTransform());
            transforms.put(PassthroughTransform.NAME, new PassthroughTransform());
        }

        /** Adds or replaces a transform. Passthrough cannot be removed, only replaced. */
        public Builder register(String name, Transform transform) {
            transforms.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(transform, "transform"));
            return this;
        }

        public TransformRegistry build() {
            return new TransformRegistry(transforms);
        }
    }
}
