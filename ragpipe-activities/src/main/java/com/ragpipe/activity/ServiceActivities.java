package com.ragpipe.activity;

import com.ragpipe.activity.embedding.Embedder;
import com.ragpipe.activity.embedding.OllamaEmbedder;
import com.ragpipe.activity.store.QdrantVectorStore;
import com.ragpipe.activity.store.VectorStore;
import com.ragpipe.config.RagPipeConfig;

import java.util.Objects;

/**
 * Activity catalogs of the services a worker process can host.
 * <ul>
 *   <li>{@code embedding_service}: chunking and embed-and-index, on the embedding task queue</li>
 *   <li>{@code retrieval_service}: search, on the retrieval task queue</li>
 *   <li>local: activities the orchestrator runs on its own queue (health check, chunking)</li>
 * </ul>
 */
public final class ServiceActivities {

    public static final String EMBEDDING_SERVICE = "embedding_service";
    public static final String RETRIEVAL_SERVICE = "retrieval_service";

    private final Embedder embedder;
    private final VectorStore store;
    private final String payloadTextField;
    private final String defaultCollection;

    public ServiceActivities(Embedder embedder, VectorStore store, String payloadTextField, String defaultCollection) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.store = Objects.requireNonNull(store, "store");
        this.payloadTextField = Objects.requireNonNull(payloadTextField, "payloadTextField");
        this.defaultCollection = Objects.requireNonNull(defaultCollection, "defaultCollection");
    }

    /** Qdrant and Ollama clients at the configured URLs. */
    public static ServiceActivities fromConfig(RagPipeConfig config) {
        return new ServiceActivities(
                new OllamaEmbedder(config.getOllamaUrl(), config.getEmbeddingModel()),
                new QdrantVectorStore(config.getQdrantUrl()),
                config.getPayloadTextField(),
                config.getDocumentCollection());
    }

    public ActivityCatalog embeddingService() {
        return ActivityCatalog.builder()
                .register(EmbedAndIndexActivity.metadata(),
                        new EmbedAndIndexActivity(embedder, store, payloadTextField, defaultCollection))
                .register(ChunkDocumentsActivity.metadata(), new ChunkDocumentsActivity())
                .build();
    }

    public ActivityCatalog retrievalService() {
        return ActivityCatalog.builder()
                .register(SearchDocumentsActivity.metadata(), new SearchDocumentsActivity(embedder, store, payloadTextField))
                .build();
    }

    public static ActivityCatalog localActivities() {
        return ActivityCatalog.builder()
                .register(HealthCheckActivity.metadata(), new HealthCheckActivity())
                .register(ChunkDocumentsActivity.metadata(), new ChunkDocumentsActivity())
                .build();
    }
}
