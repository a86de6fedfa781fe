package com.ragpipe.activity;

import com.ragpipe.activity.embedding.Embedder;
import com.ragpipe.activity.store.ScoredPoint;
import com.ragpipe.activity.store.VectorPoint;
import com.ragpipe.activity.store.VectorStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** In-memory embedder and store: vectors are {length, 1}, search returns the configured hits. */
final class FakeVectorBackend implements Embedder, VectorStore {

    final Map<String, List<VectorPoint>> upserts = new HashMap<>();
    final Map<String, Integer> collections = new HashMap<>();
    final List<String> embedded = new ArrayList<>();
    List<ScoredPoint> hits = List.of();
    RuntimeException failure;
    int lastLimit = -1;

    @Override
    public List<float[]> embed(List<String> texts) {
        if (failure != null) throw failure;
        embedded.addAll(texts);
        List<float[]> out = new ArrayList<>();
        for (String t : texts) {
            out.add(new float[] {t.length(), 1f});
        }
        return out;
    }

    @Override
    public String modelName() {
        return "fake-model";
    }

    @Override
    public void ensureCollection(String collection, int dimension) {
        collections.putIfAbsent(collection, dimension);
    }

    @Override
    public void upsert(String collection, List<VectorPoint> points) {
        upserts.computeIfAbsent(collection, c -> new ArrayList<>()).addAll(points);
    }

    @Override
    public List<ScoredPoint> search(String collection, float[] vector, int limit) {
        lastLimit = limit;
        return hits;
    }
}
