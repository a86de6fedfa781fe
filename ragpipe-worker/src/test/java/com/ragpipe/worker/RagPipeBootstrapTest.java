package com.ragpipe.worker;

import com.ragpipe.activity.ChunkDocumentsActivity;
import com.ragpipe.activity.HealthCheckActivity;
import com.ragpipe.activity.ServiceActivities;
import com.ragpipe.config.RagPipeConfig;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ExecutionKind;
import com.ragpipe.pipeline.ServiceConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RagPipeBootstrapTest {

    @Test
    void initialize_orchestratorLoadsBundledServicesDocument() {
        RagPipeConfig config = RagPipeConfig.builder()
                .services(List.of(RagPipeConfig.SERVICE_ORCHESTRATOR))
                .servicesFile("does/not/exist.yaml")
                .build();

        WorkerContext ctx = RagPipeBootstrap.initialize(config, null);

        assertTrue(ctx.isOrchestrator());
        ServiceConfig serviceConfig = ctx.getConfigHolder().orElseThrow().get();
        assertTrue(serviceConfig.getPipelines().keySet()
                .containsAll(List.of("document_processing", "document_retrieval", "health_check")));
        ActivityDescriptor embed = serviceConfig.requireActivity("perform_embedding_and_indexing_activity");
        assertEquals(ExecutionKind.REMOTE, embed.getKind());
        assertEquals("embedding-task-queue", embed.getTaskQueue());
        assertEquals(ExecutionKind.LOCAL, serviceConfig.requireActivity(HealthCheckActivity.NAME).getKind());
        assertTrue(ctx.getServicesByQueue().isEmpty());
    }

    @Test
    void initialize_activityServicesOnlyHasNoConfiguration() {
        RagPipeConfig config = RagPipeConfig.builder()
                .services(List.of(RagPipeConfig.SERVICE_EMBEDDING, RagPipeConfig.SERVICE_RETRIEVAL))
                .build();

        WorkerContext ctx = RagPipeBootstrap.initialize(config, null);

        assertFalse(ctx.isOrchestrator());
        assertEquals(List.of("embedding-task-queue", "retrieval-task-queue"), List.copyOf(ctx.getServicesByQueue().keySet()));
        assertEquals(ServiceActivities.EMBEDDING_SERVICE,
                ctx.getServicesByQueue().get("embedding-task-queue").getServiceName());
        assertTrue(ctx.getServicesByQueue().get("embedding-task-queue").getCatalog().contains(ChunkDocumentsActivity.NAME));
    }

    @Test
    void initialize_withoutServicesFails() {
        RagPipeConfig config = RagPipeConfig.builder().services(List.of()).build();

        assertThrows(IllegalStateException.class, () -> RagPipeBootstrap.initialize(config, null));
    }

    @Test
    void discoveryModeNeedsTemporalConnection() {
        RagPipeConfig config = RagPipeConfig.builder().configMode(RagPipeConfig.ConfigMode.DISCOVERY).build();

        assertThrows(IllegalStateException.class, () -> RagPipeBootstrap.createConfigSource(config, null));
    }

    @Test
    void validateLocalActivities_acceptsHostedActivities() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.local(HealthCheckActivity.NAME, null, null))
                .activity(ActivityDescriptor.remote("search_documents_activity", "retrieval_service",
                        "retrieval-task-queue", null, null))
                .build();

        assertDoesNotThrow(() -> RagPipeBootstrap.validateLocalActivities(config, ServiceActivities.localActivities()));
    }

    @Test
    void validateLocalActivities_rejectsActivityNotHostedHere() {
        ServiceConfig config = ServiceConfig.builder("test")
                .activity(ActivityDescriptor.local(HealthCheckActivity.NAME, null, null))
                .activity(ActivityDescriptor.local("rerank_activity", null, null))
                .build();

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> RagPipeBootstrap.validateLocalActivities(config, ServiceActivities.localActivities()));

        assertEquals(ConfigurationException.Kind.ACTIVITY_NOT_FOUND, e.getKind());
        assertEquals("rerank_activity", e.getSubject());
    }
}
