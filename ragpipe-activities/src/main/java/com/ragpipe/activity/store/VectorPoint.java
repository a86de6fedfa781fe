package com.ragpipe.activity.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A point to upsert: id, embedding and payload. */
public final class VectorPoint {

    private final String id;
    private final float[] vector;
    private final Map<String, Object> payload;

    public VectorPoint(String id, float[] vector, Map<String, Object> payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.vector = Objects.requireNonNull(vector, "vector");
        this.payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public float[] getVector() {
        return vector;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }
}
