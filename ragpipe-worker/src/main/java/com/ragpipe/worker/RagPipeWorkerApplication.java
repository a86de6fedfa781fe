package com.ragpipe.worker;

import com.ragpipe.config.RagPipeConfig;
import com.ragpipe.protocol.WorkerMetadataDocument;
import com.ragpipe.worker.metadata.WorkerMetadataServer;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * ragpipe worker entry point. Runs the services named in {@code RAGPIPE_SERVICES}: the orchestrator (pipeline
 * workflow and local activities) and/or the embedding and retrieval activity services, each hosted service with
 * its own metadata endpoint for discovery.
 * <p>
 * WorkerFactory.start() returns immediately; the main thread is blocked so the JVM stays alive.
 */
public final class RagPipeWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(RagPipeWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String DEFAULT_VERSION = "1.0.0";

    private RagPipeWorkerApplication() {
    }

    public static void main(String[] args) {
        RagPipeConfig config = RagPipeConfig.fromEnvironment();

        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkerContext ctx = RagPipeBootstrap.initialize(config, service);

        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );
        WorkerFactory factory = WorkerFactory.newInstance(client);
        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(10)
                .setMaxConcurrentWorkflowTaskExecutionSize(10)
                .build();
        List<String> taskQueues = RagPipeBootstrap.registerWorkers(ctx, queue -> factory.newWorker(queue, workerOptions));
        log.info("Task queues registered: {}", taskQueues);

        List<AutoCloseable> resources = new ArrayList<>();
        try {
            resources.addAll(startMetadataServers(ctx));
        } catch (IOException e) {
            closeAll(resources);
            throw new IllegalStateException("Cannot start metadata server: " + e.getMessage(), e);
        }
        if (config.getConfigMode() == RagPipeConfig.ConfigMode.DISCOVERY && ctx.isOrchestrator()) {
            resources.add(ConfigRefresher.start(ctx.getConfigHolder().orElseThrow(),
                    ctx.getConfigSource().orElseThrow(), Duration.ofSeconds(config.getDiscoveryTtlSeconds())));
        }

        log.info("Starting worker | Temporal: {} | namespace: {} | services: {} | config: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), config.getServices(), config.getConfigMode());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown(factory, resources);
        }));

        factory.start();

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown(factory, resources);
        }
    }

    /** One metadata server per hosted service; the first on the configured port, the next on the port after. */
    static List<WorkerMetadataServer> startMetadataServers(WorkerContext ctx) throws IOException {
        List<WorkerMetadataServer> servers = new ArrayList<>();
        String identity = ManagementFactory.getRuntimeMXBean().getName();
        String version = version();
        int port = ctx.getConfig().getMetadataPort();
        for (Map.Entry<String, WorkerContext.HostedService> e : ctx.getServicesByQueue().entrySet()) {
            WorkerContext.HostedService hosted = e.getValue();
            WorkerMetadataDocument document = hosted.getCatalog()
                    .toMetadataDocument(hosted.getServiceName(), e.getKey(), identity, version);
            try {
                servers.add(WorkerMetadataServer.start(document, port == 0 ? 0 : port + servers.size()));
            } catch (IOException ex) {
                closeAll(new ArrayList<>(servers));
                throw ex;
            }
        }
        return servers;
    }

    private static String version() {
        String v = RagPipeWorkerApplication.class.getPackage().getImplementationVersion();
        return v != null ? v : DEFAULT_VERSION;
    }

    private static void shutdown(WorkerFactory factory, List<AutoCloseable> resources) {
        closeAll(resources);
        factory.shutdown();
        try {
            factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.error("Error during worker shutdown: {}", e.getMessage());
        }
    }

    private static void closeAll(List<? extends AutoCloseable> resources) {
        for (AutoCloseable r : resources) {
            try {
                r.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", r, e.getMessage());
            }
        }
    }
}
