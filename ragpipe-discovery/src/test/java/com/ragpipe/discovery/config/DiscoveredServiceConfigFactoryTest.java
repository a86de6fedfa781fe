package com.ragpipe.discovery.config;

import com.ragpipe.config.WorkerEndpoint;
import com.ragpipe.discovery.DiscoveredService;
import com.ragpipe.discovery.ServiceCatalog;
import com.ragpipe.discovery.TemporalStatus;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ExecutionKind;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineOrigin;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.pipeline.load.ServiceConfigValidator;
import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.transform.TransformRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiscoveredServiceConfigFactoryTest {

    private final DiscoveredServiceConfigFactory factory = new DiscoveredServiceConfigFactory(
            new ServiceConfigValidator(TransformRegistry.defaultRegistry(), false));

    private static DiscoveredService service(String name, String queue, TemporalStatus status, ActivityMetadataDocument... activities) {
        Map<String, ActivityMetadataDocument> byName = new LinkedHashMap<>();
        for (ActivityMetadataDocument a : activities) {
            byName.put(a.getName(), a);
        }
        return new DiscoveredService(name, queue, name + "-1", "healthy", "1.0.0", byName, status,
                new WorkerEndpoint(name, "localhost", 8082));
    }

    private static ActivityMetadataDocument activity(String name, Integer timeoutSeconds, Integer attempts) {
        return new ActivityMetadataDocument(name, null, timeoutSeconds, attempts, null, null);
    }

    private static ServiceCatalog catalog(DiscoveredService... services) {
        Map<String, DiscoveredService> m = new LinkedHashMap<>();
        for (DiscoveredService s : services) {
            m.put(s.getServiceName(), s);
        }
        return new ServiceCatalog(m, Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void build_mapsActivitiesToRemoteDescriptorsWithMetadataTimeouts() {
        ServiceCatalog catalog = catalog(service("embedding_service", "embedding-task-queue", TemporalStatus.ACTIVE,
                activity("perform_embedding_and_indexing_activity", 1800, 5),
                activity("chunk_documents_activity", null, null)));

        ServiceConfig config = factory.build(catalog, null);

        ActivityDescriptor embed = config.requireActivity("perform_embedding_and_indexing_activity");
        assertEquals(ExecutionKind.REMOTE, embed.getKind());
        assertEquals("embedding-task-queue", embed.getTaskQueue());
        assertEquals(Duration.ofSeconds(1800), embed.timeout());
        assertEquals(5, embed.getRetryPolicy().getMaximumAttempts());
        ActivityDescriptor chunk = config.requireActivity("chunk_documents_activity");
        assertEquals(Duration.ofSeconds(300), chunk.timeout());
        assertEquals(3, chunk.getRetryPolicy().getMaximumAttempts());
    }

    @Test
    void build_infersPipelinesFromActivityNames() {
        ServiceCatalog catalog = catalog(
                service("embedding_service", "embedding-task-queue", TemporalStatus.ACTIVE,
                        activity("chunk_documents_activity", null, null),
                        activity("perform_embedding_and_indexing_activity", null, null)),
                service("retrieval_service", "retrieval-task-queue", TemporalStatus.INACTIVE,
                        activity("search_documents_activity", null, null)));

        ServiceConfig config = factory.build(catalog, null);

        PipelineDefinition processing = config.requirePipeline("document_processing");
        assertEquals(PipelineOrigin.INFERRED, processing.getOrigin());
        assertEquals(List.of(PipelineStep.of("chunk_documents_activity", "documents"),
                PipelineStep.of("perform_embedding_and_indexing_activity", "chunked_docs_with_collection")),
                processing.getSteps());
        PipelineDefinition retrieval = config.requirePipeline("document_retrieval");
        assertEquals("query_with_collection", retrieval.getSteps().get(0).getTransformName());
        assertTrue(config.getActivityDescriptor("search_documents_activity").isPresent());
        assertFalse(config.getPipelineDefinition("health_check").isPresent());
    }

    @Test
    void inferPipelines_noMatchingNamesInfersNothing() {
        assertTrue(DiscoveredServiceConfigFactory.inferPipelines(List.of("translate_activity", "summarize")).isEmpty());
        assertTrue(DiscoveredServiceConfigFactory.inferPipelines(List.of("chunk_only_activity")).isEmpty());
    }

    @Test
    void build_declaredPipelineWinsAndDiscoveredQueueReplacesDeclaredRemote() {
        ServiceConfig declared = ServiceConfig.builder("static")
                .activity(ActivityDescriptor.local("health_check_activity", null, null))
                .activity(ActivityDescriptor.remote("search_documents_activity", "retrieval_service",
                        "old-retrieval-queue", null, null))
                .pipeline(new PipelineDefinition("document_retrieval", "Declared Retrieval", null,
                        List.of(PipelineStep.of("search_documents_activity", "query_with_collection")),
                        PipelineOrigin.DECLARED))
                .build();
        ServiceCatalog catalog = catalog(service("retrieval_service", "retrieval-task-queue", TemporalStatus.ACTIVE,
                activity("search_documents_activity", null, null)));

        ServiceConfig config = factory.build(catalog, declared);

        assertEquals(PipelineOrigin.DECLARED, config.requirePipeline("document_retrieval").getOrigin());
        assertEquals("Declared Retrieval", config.requirePipeline("document_retrieval").getDisplayName());
        assertEquals(ExecutionKind.REMOTE, config.requireActivity("search_documents_activity").getKind());
        assertEquals("retrieval-task-queue", config.requireActivity("search_documents_activity").getTaskQueue());
        assertTrue(config.requireActivity("health_check_activity").isLocal());
        assertEquals(PipelineOrigin.INFERRED, config.requirePipeline("health_check").getOrigin());
    }

    @Test
    void build_declaredLocalActivityKeepsLocalPlacementWhenAlsoDiscovered() {
        ServiceConfig declared = ServiceConfig.builder("static")
                .activity(ActivityDescriptor.local("chunk_documents_activity", null, null))
                .activity(ActivityDescriptor.remote("perform_embedding_and_indexing_activity", "embedding_service",
                        "embedding-task-queue", null, null))
                .pipeline(new PipelineDefinition("document_processing", "Document Processing", null,
                        List.of(new PipelineStep("chunk_documents_activity", "documents", ExecutionKind.LOCAL, null),
                                new PipelineStep("perform_embedding_and_indexing_activity",
                                        "chunked_docs_with_collection", ExecutionKind.REMOTE, "embedding_service")),
                        PipelineOrigin.DECLARED))
                .build();
        ServiceCatalog catalog = catalog(service("embedding_service", "embedding-task-queue", TemporalStatus.ACTIVE,
                activity("perform_embedding_and_indexing_activity", 1800, 5),
                activity("chunk_documents_activity", 600, 3)));

        ServiceConfig config = factory.build(catalog, declared);

        ActivityDescriptor chunk = config.requireActivity("chunk_documents_activity");
        assertTrue(chunk.isLocal());
        assertNull(chunk.getTaskQueue());
        ActivityDescriptor embed = config.requireActivity("perform_embedding_and_indexing_activity");
        assertEquals(ExecutionKind.REMOTE, embed.getKind());
        assertEquals("embedding-task-queue", embed.getTaskQueue());
        assertEquals(Duration.ofSeconds(1800), embed.timeout());
        assertEquals(PipelineOrigin.DECLARED, config.requirePipeline("document_processing").getOrigin());
    }

    @Test
    void build_sameActivityOnTwoServicesIsConfigurationError() {
        ServiceCatalog catalog = catalog(
                service("a_service", "a-queue", TemporalStatus.ACTIVE, activity("shared", null, null)),
                service("b_service", "b-queue", TemporalStatus.ACTIVE, activity("shared", null, null)));

        assertThrows(ConfigurationException.class, () -> factory.build(catalog, null));
    }

    @Test
    void build_serviceWithoutQueueIsIgnored() {
        ServiceCatalog catalog = catalog(service("queueless", null, TemporalStatus.INACTIVE,
                activity("search_documents_activity", null, null)));

        ServiceConfig config = factory.build(catalog, null);

        assertTrue(config.getActivities().isEmpty());
        assertTrue(config.getPipelines().isEmpty());
    }
}
