package com.ragpipe.activity;

import com.ragpipe.activity.store.ScoredPoint;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchDocumentsActivityTest {

    private final FakeVectorBackend backend = new FakeVectorBackend();
    private final SearchDocumentsActivity activity = new SearchDocumentsActivity(backend, backend, "document");

    @Test
    @SuppressWarnings("unchecked")
    void invoke_packedArgumentsReturnHitsWithText() {
        backend.hits = List.of(
                new ScoredPoint("a", 0.9, Map.of("document", "alpha")),
                new ScoredPoint("b", 0.8, Map.of("text", "beta")),
                new ScoredPoint("c", 0.7, Map.of("other", "no text")));

        Map<String, Object> result = (Map<String, Object>) activity.invoke(List.of(List.of("what is x", "docs", 3)));

        assertEquals("success", result.get("status"));
        assertEquals("what is x", result.get("query"));
        assertEquals("docs", result.get("collection_name"));
        assertEquals(2, result.get("total_results"));
        List<Map<String, Object>> docs = (List<Map<String, Object>>) result.get("retrieved_documents");
        assertEquals(Map.of("id", "a", "text", "alpha", "score", 0.9), docs.get(0));
        assertEquals("beta", docs.get(1).get("text"));
        assertEquals(3, backend.lastLimit);
        assertEquals(List.of("what is x"), backend.embedded);
    }

    @Test
    void invoke_directArgumentsDefaultTopK() {
        activity.invoke(List.of("q", "docs"));

        assertEquals(SearchDocumentsActivity.DEFAULT_TOP_K, backend.lastLimit);
    }

    @Test
    @SuppressWarnings("unchecked")
    void invoke_backendFailureReturnsErrorDocument() {
        backend.failure = new RuntimeException("qdrant down");

        Map<String, Object> result = (Map<String, Object>) activity.invoke(List.of("q", "docs", 2));

        assertEquals("error", result.get("status"));
        assertTrue(result.get("error").toString().contains("qdrant down"));
        assertEquals(List.of(), result.get("retrieved_documents"));
        assertEquals(0, result.get("total_results"));
        assertEquals("docs", result.get("collection_name"));
    }

    @Test
    void invoke_tooFewArgumentsThrows() {
        assertThrows(IllegalArgumentException.class, () -> activity.invoke(List.of("only query")));
        assertThrows(IllegalArgumentException.class, () -> activity.invoke(List.of(List.of("q"))));
    }
}
