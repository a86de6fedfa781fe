package com.ragpipe.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs a chunk list with the target collection: {@code [chunks, collection]}.
 * Single-element list wrapping ({@code [[chunks]]}) is removed first.
 */
public final class ChunkedDocsWithCollectionTransform implements Transform {

    public static final String NAME = "chunked_docs_with_collection";

    @Override
    public List<Object> apply(Object data, TransformContext context) {
        Object chunks = data;
        while (chunks instanceof List && ((List<?>) chunks).size() == 1 && ((List<?>) chunks).get(0) instanceof List) {
            chunks = ((List<?>) chunks).get(0);
        }
        if (chunks != null && !(chunks instanceof List)) {
            throw new TransformException(NAME, "expected a list of chunks, got " + chunks.getClass().getSimpleName());
        }
        List<Object> out = new ArrayList<>(2);
        out.add(chunks != null ? chunks : new ArrayList<>());
        out.add(context.collectionFromWorkflowInput());
        return out;
    }
}
