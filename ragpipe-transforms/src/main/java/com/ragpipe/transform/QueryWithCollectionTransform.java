package com.ragpipe.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Produces {@code [query, collection, topK]} for search activities.
 * <ul>
 *   <li>string: the query itself</li>
 *   <li>list: first element stringified, empty list gives an empty query</li>
 *   <li>map: {@code query}, {@code collection} and {@code top_k} keys, each optional</li>
 *   <li>null: empty query</li>
 *   <li>any other value: stringified</li>
 * </ul>
 * Collection defaults to the executor's default collection, topK to {@value #DEFAULT_TOP_K}.
 */
public final class QueryWithCollectionTransform implements Transform {

    public static final String NAME = "query_with_collection";
    public static final int DEFAULT_TOP_K = 10;

    @Override
    public List<Object> apply(Object data, TransformContext context) {
        String collection = context.getDefaultCollection();
        if (data == null) {
            return args("", collection, DEFAULT_TOP_K);
        }
        if (data instanceof String) {
            return args((String) data, collection, DEFAULT_TOP_K);
        }
        if (data instanceof List) {
            List<?> list = (List<?>) data;
            String query = list.isEmpty() ? "" : String.valueOf(list.get(0));
            return args(query, collection, DEFAULT_TOP_K);
        }
        if (data instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) data;
            Object query = map.get("query");
            Object mapCollection = map.get("collection");
            return args(query != null ? query.toString() : "",
                    mapCollection != null ? mapCollection.toString() : collection,
                    topK(map.get("top_k")));
        }
        return args(String.valueOf(data), collection, DEFAULT_TOP_K);
    }

    private static int topK(Object value) {
        if (value == null) return DEFAULT_TOP_K;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new TransformException(NAME, "top_k is not an integer: " + value, e);
        }
    }

    private static List<Object> args(String query, String collection, int topK) {
        List<Object> out = new ArrayList<>(3);
        out.add(query);
        out.add(collection);
        out.add(topK);
        return out;
    }
}
