package com.ragpipe.activity.store;

import java.util.List;

/** Vector database as seen by the embedding and retrieval activities. Failures surface as runtime exceptions. */
public interface VectorStore {

    /** Creates the collection if missing; an existing collection is left alone. */
    void ensureCollection(String collection, int dimension) throws Exception;

    void upsert(String collection, List<VectorPoint> points) throws Exception;

    List<ScoredPoint> search(String collection, float[] vector, int limit) throws Exception;
}
