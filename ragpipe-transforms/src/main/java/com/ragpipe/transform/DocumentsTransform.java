package com.ragpipe.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens document-bearing data into a list of document records: the {@code retrieved_documents}
 * of a search result, the {@code documents} of a request, a list as-is, or a single record wrapped.
 */
public final class DocumentsTransform implements Transform {

    public static final String NAME = "documents";

    @Override
    public List<Object> apply(Object data, TransformContext context) {
        if (data == null) {
            return new ArrayList<>();
        }
        if (data instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) data;
            if (map.containsKey("retrieved_documents")) {
                return asList(map.get("retrieved_documents"), "retrieved_documents");
            }
            if (map.containsKey("documents")) {
                return asList(map.get("documents"), "documents");
            }
        }
        if (data instanceof List) {
            return new ArrayList<>((List<?>) data);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(data);
        return single;
    }

    private static List<Object> asList(Object value, String key) {
        if (value instanceof List) {
            return new ArrayList<>((List<?>) value);
        }
        throw new TransformException(NAME, "'" + key + "' must be a list, got "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }
}
