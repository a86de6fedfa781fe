package com.ragpipe.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the ragpipe Temporal worker.
 * <p>
 * Temporal: RAGPIPE_TEMPORAL_TARGET, RAGPIPE_TEMPORAL_NAMESPACE. The orchestrator (pipeline workflow) polls
 * RAGPIPE_TASK_QUEUE; service workers poll RAGPIPE_EMBEDDING_TASK_QUEUE and RAGPIPE_RETRIEVAL_TASK_QUEUE.
 * RAGPIPE_SERVICES (comma-separated) selects which of {@code orchestrator, embedding, retrieval} this process runs.
 * <p>
 * Pipeline config: RAGPIPE_CONFIG_MODE ({@code static} or {@code discovery}), RAGPIPE_SERVICES_FILE.
 * Discovery: RAGPIPE_DISCOVERY_ENDPOINTS ({@code name=host:port,...}), RAGPIPE_DISCOVERY_TTL_SECONDS.
 */
public final class RagPipeConfig {

    private static final String ENV_TEMPORAL_TARGET = "RAGPIPE_TEMPORAL_TARGET";
    private static final String ENV_TEMPORAL_NAMESPACE = "RAGPIPE_TEMPORAL_NAMESPACE";
    private static final String ENV_TASK_QUEUE = "RAGPIPE_TASK_QUEUE";
    private static final String ENV_EMBEDDING_TASK_QUEUE = "RAGPIPE_EMBEDDING_TASK_QUEUE";
    private static final String ENV_RETRIEVAL_TASK_QUEUE = "RAGPIPE_RETRIEVAL_TASK_QUEUE";
    private static final String ENV_SERVICES = "RAGPIPE_SERVICES";
    private static final String ENV_CONFIG_MODE = "RAGPIPE_CONFIG_MODE";
    private static final String ENV_SERVICES_FILE = "RAGPIPE_SERVICES_FILE";
    private static final String ENV_LENIENT_TRANSFORMS = "RAGPIPE_LENIENT_TRANSFORMS";
    private static final String ENV_DOCUMENT_COLLECTION = "DOCUMENT_COLLECTION_NAME";
    private static final String ENV_DISCOVERY_ENDPOINTS = "RAGPIPE_DISCOVERY_ENDPOINTS";
    private static final String ENV_DISCOVERY_TTL_SECONDS = "RAGPIPE_DISCOVERY_TTL_SECONDS";
    private static final String ENV_METADATA_PORT = "RAGPIPE_METADATA_PORT";
    private static final String ENV_QDRANT_URL = "QDRANT_URL";
    private static final String ENV_OLLAMA_URL = "OLLAMA_URL";
    private static final String ENV_EMBEDDING_MODEL = "EMBEDDING_MODEL";
    private static final String ENV_PAYLOAD_TEXT_FIELD = "PAYLOAD_TEXT_FIELD_NAME";

    public static final String SERVICE_ORCHESTRATOR = "orchestrator";
    public static final String SERVICE_EMBEDDING = "embedding";
    public static final String SERVICE_RETRIEVAL = "retrieval";

    private static final String DEFAULT_TEMPORAL_TARGET = "localhost:7233";
    private static final String DEFAULT_TEMPORAL_NAMESPACE = "default";
    private static final String DEFAULT_TASK_QUEUE = "rag-pipeline-task-queue";
    private static final String DEFAULT_EMBEDDING_TASK_QUEUE = "embedding-task-queue";
    private static final String DEFAULT_RETRIEVAL_TASK_QUEUE = "retrieval-task-queue";
    private static final String DEFAULT_SERVICES_FILE = "config/services.yaml";
    private static final String DEFAULT_DOCUMENT_COLLECTION = "document_chunks";
    private static final int DEFAULT_DISCOVERY_TTL_SECONDS = 30;
    private static final int DEFAULT_METADATA_PORT = 8082;
    private static final String DEFAULT_QDRANT_URL = "http://localhost:6333";
    private static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
    private static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    private static final String DEFAULT_PAYLOAD_TEXT_FIELD = "document";

    /** Where pipeline and activity configuration comes from. */
    public enum ConfigMode {
        STATIC,
        DISCOVERY;

        static ConfigMode parse(String value) {
            if (value == null || value.isBlank()) return STATIC;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return STATIC;
            }
        }
    }

    private final String temporalTarget;
    private final String temporalNamespace;
    private final String taskQueue;
    private final String embeddingTaskQueue;
    private final String retrievalTaskQueue;
    private final List<String> services;
    private final ConfigMode configMode;
    private final String servicesFile;
    private final boolean lenientTransforms;
    private final String documentCollection;
    private final List<WorkerEndpoint> discoveryEndpoints;
    private final int discoveryTtlSeconds;
    private final int metadataPort;
    private final String qdrantUrl;
    private final String ollamaUrl;
    private final String embeddingModel;
    private final String payloadTextField;

    private RagPipeConfig(Builder b) {
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.taskQueue = b.taskQueue;
        this.embeddingTaskQueue = b.embeddingTaskQueue;
        this.retrievalTaskQueue = b.retrievalTaskQueue;
        this.services = Collections.unmodifiableList(new ArrayList<>(b.services));
        this.configMode = b.configMode;
        this.servicesFile = b.servicesFile;
        this.lenientTransforms = b.lenientTransforms;
        this.documentCollection = b.documentCollection;
        this.discoveryEndpoints = Collections.unmodifiableList(new ArrayList<>(b.discoveryEndpoints));
        this.discoveryTtlSeconds = b.discoveryTtlSeconds;
        this.metadataPort = b.metadataPort;
        this.qdrantUrl = b.qdrantUrl;
        this.ollamaUrl = b.ollamaUrl;
        this.embeddingModel = b.embeddingModel;
        this.payloadTextField = b.payloadTextField;
    }

    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    /** Task queue polled by the pipeline workflow and its local activities. */
    public String getTaskQueue() {
        return taskQueue;
    }

    public String getEmbeddingTaskQueue() {
        return embeddingTaskQueue;
    }

    public String getRetrievalTaskQueue() {
        return retrievalTaskQueue;
    }

    /** Services this process runs (subset of orchestrator, embedding, retrieval). */
    public List<String> getServices() {
        return services;
    }

    public boolean runsService(String service) {
        return services.contains(service);
    }

    public ConfigMode getConfigMode() {
        return configMode;
    }

    /** Path of the static services document (YAML). */
    public String getServicesFile() {
        return servicesFile;
    }

    /** When true, unknown transform names in the static document fall back to passthrough instead of failing load. */
    public boolean isLenientTransforms() {
        return lenientTransforms;
    }

    /** Default vector collection used by transforms when the input does not name one. */
    public String getDocumentCollection() {
        return documentCollection;
    }

    public List<WorkerEndpoint> getDiscoveryEndpoints() {
        return discoveryEndpoints;
    }

    public int getDiscoveryTtlSeconds() {
        return discoveryTtlSeconds;
    }

    /** Port of the worker's /metadata and /health HTTP endpoint. */
    public int getMetadataPort() {
        return metadataPort;
    }

    public String getQdrantUrl() {
        return qdrantUrl;
    }

    public String getOllamaUrl() {
        return ollamaUrl;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    /** Payload field under which chunk text is stored in the vector store. */
    public String getPayloadTextField() {
        return payloadTextField;
    }

    public static RagPipeConfig fromEnvironment() {
        List<String> services = parseCommaSeparated(System.getenv(ENV_SERVICES));
        if (services.isEmpty()) {
            services = List.of(SERVICE_ORCHESTRATOR, SERVICE_EMBEDDING, SERVICE_RETRIEVAL);
        }
        return builder()
                .temporalTarget(getEnv(ENV_TEMPORAL_TARGET, DEFAULT_TEMPORAL_TARGET))
                .temporalNamespace(getEnv(ENV_TEMPORAL_NAMESPACE, DEFAULT_TEMPORAL_NAMESPACE))
                .taskQueue(getEnv(ENV_TASK_QUEUE, DEFAULT_TASK_QUEUE))
                .embeddingTaskQueue(getEnv(ENV_EMBEDDING_TASK_QUEUE, DEFAULT_EMBEDDING_TASK_QUEUE))
                .retrievalTaskQueue(getEnv(ENV_RETRIEVAL_TASK_QUEUE, DEFAULT_RETRIEVAL_TASK_QUEUE))
                .services(services.stream().map(s -> s.toLowerCase(Locale.ROOT)).collect(Collectors.toList()))
                .configMode(ConfigMode.parse(System.getenv(ENV_CONFIG_MODE)))
                .servicesFile(getEnv(ENV_SERVICES_FILE, DEFAULT_SERVICES_FILE))
                .lenientTransforms(parseBoolean(System.getenv(ENV_LENIENT_TRANSFORMS), false))
                .documentCollection(getEnv(ENV_DOCUMENT_COLLECTION, DEFAULT_DOCUMENT_COLLECTION))
                .discoveryEndpoints(WorkerEndpoint.parseList(System.getenv(ENV_DISCOVERY_ENDPOINTS)))
                .discoveryTtlSeconds(parseInt(System.getenv(ENV_DISCOVERY_TTL_SECONDS), DEFAULT_DISCOVERY_TTL_SECONDS))
                .metadataPort(parseInt(System.getenv(ENV_METADATA_PORT), DEFAULT_METADATA_PORT))
                .qdrantUrl(getEnv(ENV_QDRANT_URL, DEFAULT_QDRANT_URL))
                .ollamaUrl(getEnv(ENV_OLLAMA_URL, DEFAULT_OLLAMA_URL))
                .embeddingModel(getEnv(ENV_EMBEDDING_MODEL, DEFAULT_EMBEDDING_MODEL))
                .payloadTextField(cleanEnvValue(getEnv(ENV_PAYLOAD_TEXT_FIELD, DEFAULT_PAYLOAD_TEXT_FIELD)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    /** Strips a trailing {@code # comment} and surrounding quotes (values copied from .env files). */
    static String cleanEnvValue(String value) {
        if (value == null) return null;
        String v = value;
        int hash = v.indexOf('#');
        if (hash >= 0) v = v.substring(0, hash);
        v = v.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            v = v.substring(1, v.length() - 1);
        }
        return v;
    }

    public static final class Builder {
        private String temporalTarget = DEFAULT_TEMPORAL_TARGET;
        private String temporalNamespace = DEFAULT_TEMPORAL_NAMESPACE;
        private String taskQueue = DEFAULT_TASK_QUEUE;
        private String embeddingTaskQueue = DEFAULT_EMBEDDING_TASK_QUEUE;
        private String retrievalTaskQueue = DEFAULT_RETRIEVAL_TASK_QUEUE;
        private List<String> services = List.of(SERVICE_ORCHESTRATOR);
        private ConfigMode configMode = ConfigMode.STATIC;
        private String servicesFile = DEFAULT_SERVICES_FILE;
        private boolean lenientTransforms;
        private String documentCollection = DEFAULT_DOCUMENT_COLLECTION;
        private List<WorkerEndpoint> discoveryEndpoints = List.of();
        private int discoveryTtlSeconds = DEFAULT_DISCOVERY_TTL_SECONDS;
        private int metadataPort = DEFAULT_METADATA_PORT;
        private String qdrantUrl = DEFAULT_QDRANT_URL;
        private String ollamaUrl = DEFAULT_OLLAMA_URL;
        private String embeddingModel = DEFAULT_EMBEDDING_MODEL;
        private String payloadTextField = DEFAULT_PAYLOAD_TEXT_FIELD;

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget != null ? temporalTarget : DEFAULT_TEMPORAL_TARGET;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace != null ? temporalNamespace : DEFAULT_TEMPORAL_NAMESPACE;
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = Objects.requireNonNull(taskQueue, "taskQueue");
            return this;
        }

        public Builder embeddingTaskQueue(String embeddingTaskQueue) {
            this.embeddingTaskQueue = Objects.requireNonNull(embeddingTaskQueue, "embeddingTaskQueue");
            return this;
        }

        public Builder retrievalTaskQueue(String retrievalTaskQueue) {
            this.retrievalTaskQueue = Objects.requireNonNull(retrievalTaskQueue, "retrievalTaskQueue");
            return this;
        }

        public Builder services(List<String> services) {
            this.services = Objects.requireNonNull(services, "services");
            return this;
        }

        public Builder configMode(ConfigMode configMode) {
            this.configMode = configMode != null ? configMode : ConfigMode.STATIC;
            return this;
        }

        public Builder servicesFile(String servicesFile) {
            this.servicesFile = servicesFile != null ? servicesFile : DEFAULT_SERVICES_FILE;
            return this;
        }

        public Builder lenientTransforms(boolean lenientTransforms) {
            this.lenientTransforms = lenientTransforms;
            return this;
        }

        public Builder documentCollection(String documentCollection) {
            this.documentCollection = documentCollection != null ? documentCollection : DEFAULT_DOCUMENT_COLLECTION;
            return this;
        }

        public Builder discoveryEndpoints(List<WorkerEndpoint> discoveryEndpoints) {
            this.discoveryEndpoints = discoveryEndpoints != null ? discoveryEndpoints : List.of();
            return this;
        }

        public Builder discoveryTtlSeconds(int discoveryTtlSeconds) {
            this.discoveryTtlSeconds = Math.max(0, discoveryTtlSeconds);
            return this;
        }

        public Builder metadataPort(int metadataPort) {
            this.metadataPort = metadataPort;
            return this;
        }

        public Builder qdrantUrl(String qdrantUrl) {
            this.qdrantUrl = qdrantUrl != null ? qdrantUrl : DEFAULT_QDRANT_URL;
            return this;
        }

        public Builder ollamaUrl(String ollamaUrl) {
            this.ollamaUrl = ollamaUrl != null ? ollamaUrl : DEFAULT_OLLAMA_URL;
            return this;
        }

        public Builder embeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel != null ? embeddingModel : DEFAULT_EMBEDDING_MODEL;
            return this;
        }

        public Builder payloadTextField(String payloadTextField) {
            this.payloadTextField = payloadTextField != null && !payloadTextField.isBlank()
                    ? payloadTextField : DEFAULT_PAYLOAD_TEXT_FIELD;
            return this;
        }

        public RagPipeConfig build() {
            return new RagPipeConfig(this);
        }
    }
}
