package com.ragpipe.activity.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One search hit. */
public final class ScoredPoint {

    private final String id;
    private final double score;
    private final Map<String, Object> payload;

    public ScoredPoint(String id, double score, Map<String, Object> payload) {
        this.id = id;
        this.score = score;
        this.payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "ScoredPoint{" + id + ", " + score + "}";
    }
}
