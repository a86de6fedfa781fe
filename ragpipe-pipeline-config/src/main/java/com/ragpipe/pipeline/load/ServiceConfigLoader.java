package com.ragpipe.pipeline.load;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ExecutionKind;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineOrigin;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.RetryPolicySpec;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.pipeline.defaults.ActivityDefaults;
import com.ragpipe.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the services document (YAML):
 * <pre>
 * services:
 *   embedding_service:
 *     task_queue: embedding-task-queue
 *     activities:
 *       perform_embedding_and_indexing_activity: {timeout_minutes: 30, retry_attempts: 3}
 *   local_activities:
 *     chunk_documents_activity: {timeout_minutes: 10}
 * pipelines:
 *   document_processing:
 *     name: Document Processing
 *     steps:
 *       - {activity: chunk_documents_activity, type: local, input_transform: documents}
 * </pre>
 * and validates the result with {@link ServiceConfigValidator}.
 */
public final class ServiceConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigLoader.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ServiceConfigValidator validator;

    public ServiceConfigLoader(TransformRegistry transforms, boolean lenientTransforms) {
        this.validator = new ServiceConfigValidator(transforms, lenientTransforms);
    }

    public ServiceConfig load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, file.toString(),
                    "Cannot read services document " + file + ": " + e.getMessage(), e);
        }
    }

    public ServiceConfig load(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = YAML.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, sourceName,
                    "Malformed services document " + sourceName + ": " + e.getMessage(), e);
        }
        ServiceConfig config = validator.validateOrThrow(fromTree(root, sourceName));
        log.info("Loaded service configuration from {}: {} activities, pipelines {}",
                sourceName, config.getActivities().size(), config.getPipelines().keySet());
        return config;
    }

    public ServiceConfig parse(String yaml, String sourceName) {
        return load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), sourceName);
    }

    /** Builds the table without validating it; callers that merge further entries validate afterwards. */
    static ServiceConfig fromTree(JsonNode root, String sourceName) {
        if (root == null || !root.isObject()) {
            throw invalid(sourceName, "Services document " + sourceName + " is empty or not a mapping");
        }
        ServiceConfig.Builder builder = ServiceConfig.builder(sourceName);
        JsonNode services = root.path("services");
        if (!services.isMissingNode() && !services.isObject()) {
            throw invalid(sourceName, "'services' must be a mapping");
        }
        Iterator<Map.Entry<String, JsonNode>> it = services.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String serviceName = e.getKey();
            JsonNode service = e.getValue();
            if (ActivityDefaults.LOCAL_ACTIVITIES_SECTION.equals(serviceName)) {
                forEachActivity(service, sourceName, serviceName, (name, node) ->
                        builder.activity(ActivityDescriptor.local(name, timeout(node), retryPolicy(node))));
                continue;
            }
            String taskQueue = service.path("task_queue").asText(null);
            if (taskQueue == null || taskQueue.isBlank()) {
                throw invalid(serviceName, "Service '" + serviceName + "' has no task_queue (" + sourceName + ")");
            }
            forEachActivity(service.path("activities"), sourceName, serviceName, (name, node) ->
                    builder.activity(ActivityDescriptor.remote(name, serviceName, taskQueue, timeout(node), retryPolicy(node))));
        }

        JsonNode pipelines = root.path("pipelines");
        Iterator<Map.Entry<String, JsonNode>> pit = pipelines.fields();
        while (pit.hasNext()) {
            Map.Entry<String, JsonNode> e = pit.next();
            builder.pipeline(pipeline(e.getKey(), e.getValue(), sourceName));
        }
        return builder.build();
    }

    private interface ActivityEntryHandler {
        void handle(String name, JsonNode node);
    }

    private static void forEachActivity(JsonNode activities, String sourceName, String serviceName,
                                        ActivityEntryHandler handler) {
        if (activities.isMissingNode() || activities.isNull()) return;
        if (!activities.isObject()) {
            throw invalid(serviceName, "Activities of service '" + serviceName + "' must be a mapping (" + sourceName + ")");
        }
        Iterator<Map.Entry<String, JsonNode>> it = activities.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> a = it.next();
            handler.handle(a.getKey(), a.getValue());
        }
    }

    private static Duration timeout(JsonNode node) {
        JsonNode minutes = node.path("timeout_minutes");
        if (minutes.isNumber()) return Duration.ofMinutes(minutes.asLong());
        JsonNode seconds = node.path("timeout_seconds");
        if (seconds.isNumber()) return Duration.ofSeconds(seconds.asLong());
        return Duration.ofMinutes(ActivityDefaults.TIMEOUT_MINUTES);
    }

    private static RetryPolicySpec retryPolicy(JsonNode node) {
        return new RetryPolicySpec(
                intOrNull(node, "retry_initial_interval_seconds"),
                intOrNull(node, "retry_maximum_interval_seconds"),
                intOrNull(node, "retry_attempts"),
                node.path("retry_backoff_coefficient").isNumber() ? node.path("retry_backoff_coefficient").asDouble() : null);
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode v = node.path(field);
        return v.isNumber() ? v.asInt() : null;
    }

    private static PipelineDefinition pipeline(String name, JsonNode node, String sourceName) {
        JsonNode stepsNode = node.path("steps");
        if (!stepsNode.isArray()) {
            throw invalid(name, "Pipeline '" + name + "' has no steps list (" + sourceName + ")");
        }
        List<PipelineStep> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode s : stepsNode) {
            index++;
            String activity = s.path("activity").asText(null);
            if (activity == null || activity.isBlank()) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_STEP, name,
                        "Pipeline '" + name + "' step " + index + " has no activity (" + sourceName + ")");
            }
            ExecutionKind kind;
            try {
                kind = ExecutionKind.fromValue(s.path("type").asText(null));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_STEP, name,
                        "Pipeline '" + name + "' step " + index + " has unknown type '" + s.path("type").asText()
                                + "' (expected local or remote)", e);
            }
            steps.add(new PipelineStep(activity, s.path("input_transform").asText(null), kind,
                    s.path("service").asText(null)));
        }
        return new PipelineDefinition(name, node.path("name").asText(null), node.path("description").asText(null),
                steps, PipelineOrigin.DECLARED);
    }

    private static ConfigurationException invalid(String subject, String message) {
        return new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, subject, message);
    }
}
