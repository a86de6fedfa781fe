package com.ragpipe.activity;

import com.ragpipe.activity.embedding.Embedder;
import com.ragpipe.activity.store.VectorPoint;
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
 * Embeds chunk texts and upserts them into a collection. Arguments: {@code [chunks, collection]}; the collection
 * falls back to the configured default. Each point's payload is {@code {<text field>: text, id, indexed_at}}.
 */
public final class EmbedAndIndexActivity implements ActivityFunction {

    private static final Logger log = LoggerFactory.getLogger(EmbedAndIndexActivity.class);

    public static final String NAME = "perform_embedding_and_indexing_activity";

    private final Embedder embedder;
    private final VectorStore store;
    private final String payloadTextField;
    private final String defaultCollection;

    public EmbedAndIndexActivity(Embedder embedder, VectorStore store, String payloadTextField, String defaultCollection) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.store = Objects.requireNonNull(store, "store");
        this.payloadTextField = Objects.requireNonNull(payloadTextField, "payloadTextField");
        this.defaultCollection = Objects.requireNonNull(defaultCollection, "defaultCollection");
    }

    public static ActivityMetadataDocument metadata() {
        return new ActivityMetadataDocument(NAME,
                "Generates embeddings for documents and indexes them in vector database",
                1800, 3,
                List.of(new ParameterDocument("documents", "array", "Chunks with id and text", true),
                        new ParameterDocument("collection_name", "string", "Target collection", false)),
                new ReturnsDocument("object", "Indexing summary with indexed_count and collection_name"));
    }

    @Override
    public Object invoke(List<Object> args) {
        if (args.isEmpty() || !(args.get(0) instanceof List)) {
            throw new IllegalArgumentException("Expected [documents, collection_name], got " + args);
        }
        List<?> documents = (List<?>) args.get(0);
        String collection = args.size() > 1 && args.get(1) != null && !args.get(1).toString().isBlank()
                ? args.get(1).toString() : defaultCollection;
        List<String> ids = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (Object d : documents) {
            if (!(d instanceof Map)) {
                throw new IllegalArgumentException("Document is not an object: " + d);
            }
            Map<?, ?> doc = (Map<?, ?>) d;
            Object id = doc.get("id");
            Object text = doc.get("text");
            if (id == null || text == null) {
                throw new IllegalArgumentException("Document must have 'id' and 'text': " + doc.keySet());
            }
            ids.add(id.toString());
            texts.add(text.toString());
        }
        long start = System.nanoTime();
        log.info("Starting embedding and indexing for {} documents in collection '{}'", documents.size(), collection);
        try {
            if (!texts.isEmpty()) {
                List<float[]> vectors = embedder.embed(texts);
                store.ensureCollection(collection, vectors.get(0).length);
                double indexedAt = System.currentTimeMillis() / 1000.0;
                List<VectorPoint> points = new ArrayList<>(texts.size());
                for (int i = 0; i < texts.size(); i++) {
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put(payloadTextField, texts.get(i));
                    payload.put("id", ids.get(i));
                    payload.put("indexed_at", indexedAt);
                    points.add(new VectorPoint(ids.get(i), vectors.get(i), payload));
                }
                store.upsert(collection, points);
            }
            double elapsed = elapsedSeconds(start);
            log.info("Successfully indexed {} documents in {}s", texts.size(), String.format("%.2f", elapsed));

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("status", "success");
            result.put("indexed_count", texts.size());
            result.put("collection_name", collection);
            result.put("embedding_model", embedder.modelName());
            result.put("elapsed_time", elapsed);
            result.put("timestamp", System.currentTimeMillis() / 1000.0);
            return result;
        } catch (Exception e) {
            log.error("Failed to embed and index documents after {}s: {}",
                    String.format("%.2f", elapsedSeconds(start)), e.getMessage());
            throw new ActivityException("Failed to embed and index documents: " + e.getMessage(), e);
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
