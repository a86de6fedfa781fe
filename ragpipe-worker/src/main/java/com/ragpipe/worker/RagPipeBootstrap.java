package com.ragpipe.worker;

import com.ragpipe.activity.ActivityCatalog;
import com.ragpipe.activity.ServiceActivities;
import com.ragpipe.config.RagPipeConfig;
import com.ragpipe.discovery.CatalogCache;
import com.ragpipe.discovery.DiscoveryService;
import com.ragpipe.discovery.HttpWorkerMetadataClient;
import com.ragpipe.discovery.TemporalTaskQueueInspector;
import com.ragpipe.discovery.config.DiscoveredServiceConfigFactory;
import com.ragpipe.discovery.config.DiscoveryServiceConfigSource;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.pipeline.load.ServiceConfigHolder;
import com.ragpipe.pipeline.load.ServiceConfigLoader;
import com.ragpipe.pipeline.load.ServiceConfigSource;
import com.ragpipe.pipeline.load.ServiceConfigValidator;
import com.ragpipe.pipeline.load.StaticServiceConfigSource;
import com.ragpipe.transform.TransformRegistry;
import com.ragpipe.worker.activity.ActivityDispatcher;
import com.ragpipe.worker.activity.PipelineActivitiesImpl;
import com.ragpipe.worker.engine.ServiceConfigPlanResolver;
import com.ragpipe.worker.workflow.GenericPipelineWorkflowImpl;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bootstrap for the ragpipe worker: builds the service configuration (static file or discovery), checks that
 * every local activity it names is hosted here, and assembles the activity catalogs of the services this
 * process runs ({@code RAGPIPE_SERVICES}). Configuration errors stop startup.
 */
public final class RagPipeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RagPipeBootstrap.class);

    private RagPipeBootstrap() {
    }

    /**
     * @param service Temporal connection, used by discovery to describe task queues; may be null in static mode
     */
    public static WorkerContext initialize(RagPipeConfig config, WorkflowServiceStubs service) {
        return initialize(config, ServiceActivities.fromConfig(config), service);
    }

    static WorkerContext initialize(RagPipeConfig config, ServiceActivities activities, WorkflowServiceStubs service) {
        log.info("Bootstrap: services={} mode={} taskQueue={}", config.getServices(), config.getConfigMode(),
                config.getTaskQueue());
        ActivityCatalog local = ServiceActivities.localActivities();

        ServiceConfigHolder holder = null;
        ServiceConfigSource source = null;
        if (config.runsService(RagPipeConfig.SERVICE_ORCHESTRATOR)) {
            source = createConfigSource(config, service);
            holder = ServiceConfigHolder.initialize(source);
            validateLocalActivities(holder.get(), local);
            log.info("Bootstrap: pipelines {} from {}", holder.get().getPipelines().keySet(), source.describe());
        }

        Map<String, WorkerContext.HostedService> services = new LinkedHashMap<>();
        if (config.runsService(RagPipeConfig.SERVICE_EMBEDDING)) {
            services.put(config.getEmbeddingTaskQueue(),
                    new WorkerContext.HostedService(ServiceActivities.EMBEDDING_SERVICE, activities.embeddingService()));
        }
        if (config.runsService(RagPipeConfig.SERVICE_RETRIEVAL)) {
            services.put(config.getRetrievalTaskQueue(),
                    new WorkerContext.HostedService(ServiceActivities.RETRIEVAL_SERVICE, activities.retrievalService()));
        }
        if (holder == null && services.isEmpty()) {
            throw new IllegalStateException("No services to run; set RAGPIPE_SERVICES (e.g. orchestrator,embedding,retrieval)");
        }
        return new WorkerContext(config, holder, source, local, services);
    }

    /** Static file, or discovery merged with the static file's local activities and declared pipelines. */
    static ServiceConfigSource createConfigSource(RagPipeConfig config, WorkflowServiceStubs service) {
        TransformRegistry transforms = TransformRegistry.defaultRegistry();
        ServiceConfigSource declared = new StaticServiceConfigSource(Path.of(config.getServicesFile()),
                new ServiceConfigLoader(transforms, config.isLenientTransforms()));
        if (config.getConfigMode() == RagPipeConfig.ConfigMode.STATIC) {
            return declared;
        }
        if (service == null) {
            throw new IllegalStateException("Discovery mode needs a Temporal connection");
        }
        Clock clock = Clock.systemUTC();
        DiscoveryService discovery = new DiscoveryService(
                config.getDiscoveryEndpoints(),
                new HttpWorkerMetadataClient(),
                new TemporalTaskQueueInspector(service, config.getTemporalNamespace()),
                new CatalogCache(Duration.ofSeconds(config.getDiscoveryTtlSeconds()), clock),
                clock);
        return new DiscoveryServiceConfigSource(discovery,
                new DiscoveredServiceConfigFactory(new ServiceConfigValidator(transforms, config.isLenientTransforms())),
                declared);
    }

    /** Every LOCAL activity named by the configuration must be hosted by this worker. */
    static void validateLocalActivities(ServiceConfig config, ActivityCatalog local) {
        List<String> missing = new ArrayList<>();
        for (String name : config.localActivityNames()) {
            if (!local.contains(name)) missing.add(name);
        }
        if (!missing.isEmpty()) {
            log.error("Local activities {} are configured but not hosted by this worker {}", missing, local.names());
            throw new ConfigurationException(ConfigurationException.Kind.ACTIVITY_NOT_FOUND, missing.get(0),
                    "Local activities not available in this worker: " + missing);
        }
    }

    /**
     * Creates one worker per task queue: the orchestrator queue gets the pipeline workflow, the plan activity and
     * the local activities; each hosted service queue gets a dispatcher over its catalog.
     *
     * @param newWorker creates a worker polling the given task queue
     * @return task queues registered
     */
    public static List<String> registerWorkers(WorkerContext ctx, Function<String, Worker> newWorker) {
        List<String> queues = new ArrayList<>();
        ctx.getConfigHolder().ifPresent(holder -> {
            String queue = ctx.getConfig().getTaskQueue();
            Worker worker = newWorker.apply(queue);
            worker.registerWorkflowImplementationTypes(GenericPipelineWorkflowImpl.class);
            worker.registerActivitiesImplementations(
                    new PipelineActivitiesImpl(new ServiceConfigPlanResolver(holder::get,
                            ctx.getConfig().getDocumentCollection())),
                    new ActivityDispatcher(ctx.getLocalActivities()));
            queues.add(queue);
            log.info("Registered orchestrator worker for task queue: {} (local activities {})", queue,
                    ctx.getLocalActivities().names());
        });
        ctx.getServicesByQueue().forEach((queue, hosted) -> {
            Worker worker = newWorker.apply(queue);
            worker.registerActivitiesImplementations(new ActivityDispatcher(hosted.getCatalog()));
            queues.add(queue);
            log.info("Registered {} worker for task queue: {} (activities {})", hosted.getServiceName(), queue,
                    hosted.getCatalog().names());
        });
        return queues;
    }
}
