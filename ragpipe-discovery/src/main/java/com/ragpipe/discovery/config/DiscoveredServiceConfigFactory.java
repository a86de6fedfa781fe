package com.ragpipe.discovery.config;

import com.ragpipe.discovery.DiscoveredService;
import com.ragpipe.discovery.ServiceCatalog;
import com.ragpipe.discovery.TemporalStatus;
import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineOrigin;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.RetryPolicySpec;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.pipeline.load.ServiceConfigValidator;
import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.transform.ChunkedDocsWithCollectionTransform;
import com.ragpipe.transform.DocumentsTransform;
import com.ragpipe.transform.PassthroughTransform;
import com.ragpipe.transform.QueryWithCollectionTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns a {@link ServiceCatalog} into a {@link ServiceConfig}: every discovered activity becomes a REMOTE descriptor
 * on its service's task queue. Declared configuration (optional) contributes local activities and pipelines.
 * A declared local activity keeps its local placement even when a discovered service also advertises it; a declared
 * remote activity yields to the discovered placement. Declared pipelines always win over inferred ones.
 * <p>
 * Pipeline inference is a best-effort guess from activity names and is logged as such:
 * <ul>
 *   <li>{@code document_processing}: first activity containing "chunk", then first containing "embedding" or "index"</li>
 *   <li>{@code document_retrieval}: first activity containing "search"</li>
 *   <li>{@code health_check}: first activity containing "health"</li>
 * </ul>
 */
public final class DiscoveredServiceConfigFactory {

    private static final Logger log = LoggerFactory.getLogger(DiscoveredServiceConfigFactory.class);

    public static final String DOCUMENT_PROCESSING = "document_processing";
    public static final String DOCUMENT_RETRIEVAL = "document_retrieval";
    public static final String HEALTH_CHECK = "health_check";

    private final ServiceConfigValidator validator;

    public DiscoveredServiceConfigFactory(ServiceConfigValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @param catalog  hybrid discovery result
     * @param declared static configuration to merge, or null
     */
    public ServiceConfig build(ServiceCatalog catalog, ServiceConfig declared) {
        ServiceConfig.Builder builder = ServiceConfig.builder("discovery@" + catalog.getDiscoveredAt());
        Set<String> declaredLocal = new HashSet<>();
        if (declared != null) {
            for (ActivityDescriptor d : declared.getActivities().values()) {
                if (d.isLocal()) {
                    builder.activity(d);
                    declaredLocal.add(d.getName());
                }
            }
        }
        for (DiscoveredService service : catalog.services()) {
            if (service.getTaskQueue() == null || service.getTaskQueue().isBlank()) {
                log.warn("Discovered service {} declares no task queue; its activities are ignored", service.getServiceName());
                continue;
            }
            if (service.getTemporalStatus() == TemporalStatus.INACTIVE) {
                log.warn("Including activities of inactive service {} (queue {} has no pollers)",
                        service.getServiceName(), service.getTaskQueue());
            }
            for (ActivityMetadataDocument a : service.getActivities().values()) {
                if (declaredLocal.contains(a.getName())) {
                    log.info("Activity {} is declared local; discovered placement on {} ignored",
                            a.getName(), service.getTaskQueue());
                    continue;
                }
                builder.activity(ActivityDescriptor.remote(a.getName(), service.getServiceName(), service.getTaskQueue(),
                        Duration.ofSeconds(a.getTimeoutSeconds()),
                        new RetryPolicySpec(null, null, a.getRetryAttempts(), null)));
            }
        }
        if (declared != null) {
            for (ActivityDescriptor d : declared.getActivities().values()) {
                if (d.isLocal()) {
                    continue;
                }
                if (builder.hasActivity(d.getName())) {
                    log.debug("Remote activity {} is both declared and discovered; using discovered placement", d.getName());
                    continue;
                }
                builder.activity(d);
            }
            declared.getPipelines().values().forEach(builder::pipeline);
        }
        ServiceConfig withActivities = builder.build();
        for (PipelineDefinition inferred : inferPipelines(new ArrayList<>(withActivities.getActivities().keySet()))) {
            if (builder.hasPipeline(inferred.getName())) {
                log.debug("Pipeline {} is declared; inferred variant ignored", inferred.getName());
                continue;
            }
            log.info("Pipeline {} INFERRED from discovered activities: {}", inferred.getName(), inferred.getSteps());
            builder.pipeline(inferred);
        }
        return validator.validateOrThrow(builder.build());
    }

    /** Pipelines guessed from activity names; activities that do not match any pattern produce nothing. */
    static List<PipelineDefinition> inferPipelines(List<String> activityNames) {
        List<PipelineDefinition> out = new ArrayList<>();
        Optional<String> chunk = first(activityNames, n -> n.contains("chunk"));
        Optional<String> embed = first(activityNames, n -> !n.contains("chunk") && (n.contains("embedding") || n.contains("index")));
        if (chunk.isPresent() && embed.isPresent()) {
            out.add(new PipelineDefinition(DOCUMENT_PROCESSING, "Document Processing",
                    "Inferred: chunk documents then embed and index",
                    List.of(PipelineStep.of(chunk.get(), DocumentsTransform.NAME),
                            PipelineStep.of(embed.get(), ChunkedDocsWithCollectionTransform.NAME)),
                    PipelineOrigin.INFERRED));
        }
        first(activityNames, n -> n.contains("search")).ifPresent(search ->
                out.add(new PipelineDefinition(DOCUMENT_RETRIEVAL, "Document Retrieval",
                        "Inferred: search documents",
                        List.of(PipelineStep.of(search, QueryWithCollectionTransform.NAME)),
                        PipelineOrigin.INFERRED)));
        first(activityNames, n -> n.contains("health")).ifPresent(health ->
                out.add(new PipelineDefinition(HEALTH_CHECK, "Health Check", "Inferred: health check",
                        List.of(PipelineStep.of(health, PassthroughTransform.NAME)),
                        PipelineOrigin.INFERRED)));
        return out;
    }

    private static Optional<String> first(List<String> names, Predicate<String> match) {
        return names.stream().filter(n -> match.test(n.toLowerCase(Locale.ROOT))).findFirst();
    }
}
