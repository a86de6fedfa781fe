package com.ragpipe.transform;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformRegistryTest {

    private static final String DEFAULT_COLLECTION = "default_collection";
    private static final TransformContext NO_INPUT = TransformContext.of(Map.of(), DEFAULT_COLLECTION);

    private final TransformRegistry registry = TransformRegistry.defaultRegistry();

    @Test
    void get_resolvesBuiltInsAndFallsBackToPassthrough() {
        assertInstanceOf(DocumentsTransform.class, registry.get("documents"));
        assertInstanceOf(ChunkedDocsWithCollectionTransform.class, registry.get("chunked_docs_with_collection"));
        assertInstanceOf(QueryWithCollectionTransform.class, registry.get("query_with_collection"));
        assertInstanceOf(PassthroughTransform.class, registry.get("passthrough"));
        assertSame(registry.get("passthrough"), registry.get("non_existent_transform"));
        assertSame(registry.get("passthrough"), registry.get(null));
        assertFalse(registry.contains("non_existent_transform"));
        assertTrue(registry.contains("documents"));
    }

    @Test
    void queryWithCollection_acceptedShapesAgreeOnCanonicalForm() {
        Transform t = registry.get("query_with_collection");
        List<Object> expected = List.of("q", DEFAULT_COLLECTION, 10);

        assertEquals(expected, t.apply("q", NO_INPUT));
        assertEquals(expected, t.apply(List.of("q"), NO_INPUT));
        assertEquals(expected, t.apply(Map.of("query", "q"), NO_INPUT));
        assertEquals(expected, t.apply(expected, NO_INPUT));
    }

    @Test
    void queryWithCollection_bareStringUsesDefaultCollection() {
        List<Object> args = registry.get("query_with_collection")
                .apply("machine learning", TransformContext.of("machine learning", "docs"));

        assertEquals(List.of("machine learning", "docs", 10), args);
    }

    @Test
    void queryWithCollection_mapOverridesCollectionAndTopK() {
        Map<String, Object> data = Map.of("query", "my query", "top_k", 5, "collection", "custom");

        assertEquals(List.of("my query", "custom", 5), registry.get("query_with_collection").apply(data, NO_INPUT));
    }

    @Test
    void queryWithCollection_nullEmptyListAndScalars() {
        Transform t = registry.get("query_with_collection");

        assertEquals(List.of("", DEFAULT_COLLECTION, 10), t.apply(null, NO_INPUT));
        assertEquals(List.of("", DEFAULT_COLLECTION, 10), t.apply(List.of(), NO_INPUT));
        assertEquals(List.of("42", DEFAULT_COLLECTION, 10), t.apply(42, NO_INPUT));
        assertEquals(List.of("{nested=query}", DEFAULT_COLLECTION, 10), t.apply(List.of(Map.of("nested", "query")), NO_INPUT));
    }

    @Test
    void queryWithCollection_nonNumericTopKIsTransformError() {
        TransformException e = assertThrows(TransformException.class,
                () -> registry.get("query_with_collection").apply(Map.of("query", "q", "top_k", "many"), NO_INPUT));

        assertEquals("query_with_collection", e.getTransformName());
    }

    @Test
    void documents_flattensKnownShapes() {
        Map<String, Object> doc = Map.of("id", "doc1", "text", "some text");
        Transform t = registry.get("documents");

        assertEquals(List.of(doc), t.apply(Map.of("documents", List.of(doc)), NO_INPUT));
        assertEquals(List.of(doc), t.apply(Map.of("retrieved_documents", List.of(doc)), NO_INPUT));
        assertEquals(List.of(doc), t.apply(List.of(doc), NO_INPUT));
        assertEquals(List.of(doc), t.apply(doc, NO_INPUT));
        assertTrue(t.apply(null, NO_INPUT).isEmpty());
    }

    @Test
    void documents_nonListDocumentsIsTransformError() {
        assertThrows(TransformException.class,
                () -> registry.get("documents").apply(Map.of("documents", "not a list"), NO_INPUT));
    }

    @Test
    void chunkedDocs_unwrapsNestingAndTakesCollectionFromWorkflowInput() {
        Map<String, Object> chunk = Map.of("id", "chunk1");
        Transform t = registry.get("chunked_docs_with_collection");
        TransformContext withCollection = TransformContext.of(Map.of("collection", "my_test_collection"), DEFAULT_COLLECTION);

        assertEquals(List.of(List.of(chunk), "my_test_collection"),
                t.apply(List.of(List.of(List.of(chunk))), withCollection));
        assertEquals(List.of(List.of(chunk), DEFAULT_COLLECTION), t.apply(List.of(chunk), NO_INPUT));
        assertEquals(List.of(List.of(chunk), DEFAULT_COLLECTION),
                t.apply(List.of(chunk), TransformContext.of("plain string input", DEFAULT_COLLECTION)));
    }

    @Test
    void passthrough_wrapsNonListValues() {
        Transform t = registry.get("passthrough");

        assertEquals(List.of(Map.of("key", "value")), t.apply(Map.of("key", "value"), NO_INPUT));
        assertEquals(List.of("item1", "item2"), t.apply(List.of("item1", "item2"), NO_INPUT));
    }

    @Test
    void builder_registersCustomTransform() {
        TransformRegistry custom = TransformRegistry.builder()
                .register("upper", (data, ctx) -> List.of(String.valueOf(data).toUpperCase()))
                .build();

        assertEquals(List.of("ABC"), custom.get("upper").apply("abc", NO_INPUT));
        assertTrue(custom.names().contains("passthrough"));
    }
}
