package com.ragpipe.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RagPipeConfigTest {

    @Test
    void builder_defaults() {
        RagPipeConfig config = RagPipeConfig.builder().build();

        assertEquals("localhost:7233", config.getTemporalTarget());
        assertEquals("default", config.getTemporalNamespace());
        assertEquals("rag-pipeline-task-queue", config.getTaskQueue());
        assertEquals("embedding-task-queue", config.getEmbeddingTaskQueue());
        assertEquals("retrieval-task-queue", config.getRetrievalTaskQueue());
        assertEquals("document_chunks", config.getDocumentCollection());
        assertEquals(RagPipeConfig.ConfigMode.STATIC, config.getConfigMode());
        assertEquals(30, config.getDiscoveryTtlSeconds());
        assertFalse(config.isLenientTransforms());
        assertTrue(config.runsService(RagPipeConfig.SERVICE_ORCHESTRATOR));
        assertFalse(config.runsService(RagPipeConfig.SERVICE_EMBEDDING));
    }

    @Test
    void parseCommaSeparated_trimsAndDropsBlanks() {
        assertEquals(List.of("orchestrator", "embedding"),
                RagPipeConfig.parseCommaSeparated(" orchestrator , ,embedding "));
        assertTrue(RagPipeConfig.parseCommaSeparated("  ").isEmpty());
    }

    @Test
    void cleanEnvValue_stripsCommentAndQuotes() {
        assertEquals("text", RagPipeConfig.cleanEnvValue("\"text\"  # payload field"));
        assertEquals("document", RagPipeConfig.cleanEnvValue("document"));
    }

    @Test
    void configMode_unknownValueFallsBackToStatic() {
        RagPipeConfig config = RagPipeConfig.builder().configMode(null).build();

        assertEquals(RagPipeConfig.ConfigMode.STATIC, config.getConfigMode());
    }

    @Test
    void workerEndpoint_parsesNamedAndBareSpecs() {
        List<WorkerEndpoint> endpoints = WorkerEndpoint.parseList("embedding=embedding-worker:8082, localhost:8083");

        assertEquals(2, endpoints.size());
        assertEquals(new WorkerEndpoint("embedding", "embedding-worker", 8082), endpoints.get(0));
        assertEquals("localhost:8083", endpoints.get(1).getName());
        assertEquals("http://localhost:8083", endpoints.get(1).baseUrl());
    }

    @Test
    void workerEndpoint_rejectsMissingPort() {
        assertThrows(IllegalArgumentException.class, () -> WorkerEndpoint.parse("embedding=worker"));
        assertThrows(IllegalArgumentException.class, () -> WorkerEndpoint.parse("worker:abc"));
    }
}
