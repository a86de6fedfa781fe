package com.ragpipe.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerMetadataDocumentTest {

    private static final String EMBEDDING_METADATA = """
            {
              "service_name": "embedding_service",
              "task_queue": "embedding-task-queue",
              "worker_identity": "embedding-worker-1",
              "health": "healthy",
              "version": "1.0.0",
              "started_at": "ignored",
              "activities": [
                {
                  "name": "perform_embedding_and_indexing_activity",
                  "description": "Embed chunks and index them",
                  "timeout_seconds": 1800,
                  "retry_attempts": 3,
                  "parameters": [
                    {"name": "chunks", "type": "List[Dict]", "description": "chunks", "required": true},
                    {"name": "collection_name", "type": "str", "description": "target collection", "required": false}
                  ],
                  "returns": {"type": "Dict", "description": "indexing summary"}
                },
                {"name": "chunk_documents_activity"}
              ]
            }
            """;

    @Test
    void fromJson_readsSnakeCaseFieldsAndIgnoresUnknown() throws Exception {
        WorkerMetadataDocument doc = WorkerMetadataDocument.fromJson(EMBEDDING_METADATA);

        assertEquals("embedding_service", doc.getServiceName());
        assertEquals("embedding-task-queue", doc.getTaskQueue());
        assertEquals("embedding-worker-1", doc.getWorkerIdentity());
        assertEquals(2, doc.getActivities().size());
        ActivityMetadataDocument embed = doc.getActivities().get(0);
        assertEquals(1800, embed.getTimeoutSeconds());
        assertEquals(2, embed.getParameters().size());
        assertTrue(embed.getParameters().get(0).isRequired());
        assertEquals("Dict", embed.getReturns().getType());
    }

    @Test
    void fromJson_appliesActivityDefaults() throws Exception {
        ActivityMetadataDocument chunk = WorkerMetadataDocument.fromJson(EMBEDDING_METADATA).getActivities().get(1);

        assertEquals(ActivityMetadataDocument.DEFAULT_TIMEOUT_SECONDS, chunk.getTimeoutSeconds());
        assertEquals(ActivityMetadataDocument.DEFAULT_RETRY_ATTEMPTS, chunk.getRetryAttempts());
        assertTrue(chunk.getParameters().isEmpty());
    }

    @Test
    void fromJson_missingActivitiesIsNull() throws Exception {
        WorkerMetadataDocument doc = WorkerMetadataDocument.fromJson("{\"status\":\"healthy\"}");

        assertNull(doc.getActivities());
        assertEquals(WorkerMetadataDocument.HEALTH_HEALTHY, doc.getHealth());
    }

    @Test
    void toJson_isReadBackUnchanged() throws Exception {
        WorkerMetadataDocument doc = WorkerMetadataDocument.fromJson(EMBEDDING_METADATA);

        String json = doc.toJson();

        assertTrue(json.contains("\"task_queue\":\"embedding-task-queue\""));
        assertEquals(doc, WorkerMetadataDocument.fromJson(json));
    }
}
