package com.ragpipe.activity;

import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.protocol.ParameterDocument;
import com.ragpipe.protocol.ReturnsDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Splits documents into paragraph chunks on blank lines. Each argument is either a document map
 * ({@code {id, text, metadata}}) or a list of them; both shapes are flattened in order.
 * <p>
 * Chunk record: {@code {id: <uuid>, text, metadata: {...source metadata, original_doc_id, chunk_index, total_chunks}}}.
 */
public final class ChunkDocumentsActivity implements ActivityFunction {

    private static final Logger log = LoggerFactory.getLogger(ChunkDocumentsActivity.class);

    public static final String NAME = "chunk_documents_activity";
    static final String PARAGRAPH_SEPARATOR = "\n\n";

    public static ActivityMetadataDocument metadata() {
        return new ActivityMetadataDocument(NAME,
                "Chunks documents into smaller text segments for processing",
                600, 3,
                List.of(new ParameterDocument("documents", "array", "Documents with id, text and optional metadata", true)),
                new ReturnsDocument("array", "Chunk records with id, text and metadata"));
    }

    @Override
    public Object invoke(List<Object> args) {
        List<Map<String, Object>> documents = flatten(args);
        List<Map<String, Object>> chunks = new ArrayList<>();
        for (Map<String, Object> doc : documents) {
            chunks.addAll(chunk(doc));
        }
        log.info("Chunked {} documents into {} chunks", documents.size(), chunks.size());
        return chunks;
    }

    static List<Map<String, Object>> chunk(Map<String, Object> doc) {
        Object text = doc.get("text");
        if (text == null || text.toString().isBlank()) {
            return List.of();
        }
        List<String> paragraphs = new ArrayList<>();
        for (String part : text.toString().split(PARAGRAPH_SEPARATOR)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) paragraphs.add(trimmed);
        }
        Map<String, Object> sourceMetadata = doc.get("metadata") instanceof Map
                ? asMap(doc.get("metadata")) : Map.of();
        Object originalId = doc.get("id");
        List<Map<String, Object>> out = new ArrayList<>(paragraphs.size());
        for (int i = 0; i < paragraphs.size(); i++) {
            Map<String, Object> metadata = new LinkedHashMap<>(sourceMetadata);
            metadata.put("original_doc_id", originalId != null ? originalId.toString() : null);
            metadata.put("chunk_index", i);
            metadata.put("total_chunks", paragraphs.size());
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("id", UUID.randomUUID().toString());
            record.put("text", paragraphs.get(i));
            record.put("metadata", metadata);
            out.add(record);
        }
        return out;
    }

    private static List<Map<String, Object>> flatten(List<Object> args) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object arg : args) {
            collect(arg, out);
        }
        return out;
    }

    private static void collect(Object value, List<Map<String, Object>> out) {
        if (value instanceof Map) {
            out.add(asMap(value));
        } else if (value instanceof List) {
            for (Object item : (List<?>) value) {
                collect(item, out);
            }
        } else if (value != null) {
            throw new IllegalArgumentException("Expected a document or a list of documents, got "
                    + value.getClass().getSimpleName());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
