package com.ragpipe.activity;

import com.ragpipe.activity.embedding.Embedder;
import com.ragpipe.activity.store.ScoredPoint;
import com.ragpipe.activity.store.VectorStore;
import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.protocol.ParameterDocument;
import com.ragpipe.protocol.ReturnsDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Semantic search over a collection. Accepts packed {@code [[query, collection, topK]]} or direct
 * {@code (query, collection, topK)} arguments; topK defaults to 5.
 * <p>
 * A store or embedder failure does not fail the activity: the result carries {@code status=error} and an empty
 * document list. Malformed arguments still throw.
 */
public final class SearchDocumentsActivity implements ActivityFunction {

    private static final Logger log = LoggerFactory.getLogger(SearchDocumentsActivity.class);

    public static final String NAME = "search_documents_activity";
    public static final int DEFAULT_TOP_K = 5;

    private final Embedder embedder;
    private final VectorStore store;
    private final String payloadTextField;

    public SearchDocumentsActivity(Embedder embedder, VectorStore store, String payloadTextField) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.store = Objects.requireNonNull(store, "store");
        this.payloadTextField = Objects.requireNonNull(payloadTextField, "payloadTextField");
    }

    public static ActivityMetadataDocument metadata() {
        return new ActivityMetadataDocument(NAME,
                "Searches a collection for documents similar to the query",
                300, 3,
                List.of(new ParameterDocument("query", "string", "Query text", true),
                        new ParameterDocument("collection_name", "string", "Collection to search", true),
                        new ParameterDocument("top_k", "integer", "Maximum number of results", false)),
                new ReturnsDocument("object", "Search result with retrieved_documents"));
    }

    /** Query, collection and topK from either argument shape. */
    static final class SearchArgs {
        final String query;
        final String collection;
        final int topK;

        SearchArgs(String query, String collection, int topK) {
            this.query = query;
            this.collection = collection;
            this.topK = topK;
        }

        static SearchArgs from(List<Object> args) {
            List<?> values;
            if (args.size() == 1 && args.get(0) instanceof List && ((List<?>) args.get(0)).size() >= 2) {
                values = (List<?>) args.get(0);
            } else if (args.size() >= 2) {
                values = args;
            } else {
                throw new IllegalArgumentException(
                        "Expected at least 2 arguments (query, collection), got " + args.size() + ": " + args);
            }
            int topK = values.size() > 2 && values.get(2) != null ? toInt(values.get(2)) : DEFAULT_TOP_K;
            return new SearchArgs(String.valueOf(values.get(0)), String.valueOf(values.get(1)), topK);
        }

        private static int toInt(Object value) {
            if (value instanceof Number) return ((Number) value).intValue();
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("top_k is not an integer: " + value, e);
            }
        }
    }

    @Override
    public Object invoke(List<Object> args) {
        SearchArgs a = SearchArgs.from(args);
        long start = System.nanoTime();
        log.info("Starting document search for query '{}' in collection '{}'", a.query, a.collection);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("query", a.query);
        try {
            float[] vector = embedder.embed(List.of(a.query)).get(0);
            List<Map<String, Object>> retrieved = new ArrayList<>();
            for (ScoredPoint hit : store.search(a.collection, vector, a.topK)) {
                Object text = hit.getPayload().get(payloadTextField);
                if (text == null && !"text".equals(payloadTextField)) {
                    text = hit.getPayload().get("text");
                }
                if (text == null) {
                    log.warn("Hit with ID {} has no text content available", hit.getId());
                    continue;
                }
                Map<String, Object> doc = new LinkedHashMap<>();
                doc.put("id", hit.getId());
                doc.put("text", text.toString());
                doc.put("score", hit.getScore());
                retrieved.add(doc);
            }
            double elapsed = elapsedSeconds(start);
            log.info("Search completed in {}s. Found {} results", String.format("%.4f", elapsed), retrieved.size());
            result.put("status", "success");
            result.put("retrieved_documents", retrieved);
            result.put("total_results", retrieved.size());
            result.put("processing_time", elapsed);
        } catch (Exception e) {
            double elapsed = elapsedSeconds(start);
            String message = String.format("Search failed after %.4f seconds: %s", elapsed, e.getMessage());
            log.error(message, e);
            result.put("status", "error");
            result.put("error", message);
            result.put("retrieved_documents", List.of());
            result.put("total_results", 0);
            result.put("processing_time", elapsed);
        }
        result.put("collection_name", a.collection);
        return result;
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
