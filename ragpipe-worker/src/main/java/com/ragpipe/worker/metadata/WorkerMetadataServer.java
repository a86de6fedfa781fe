package com.ragpipe.worker.metadata;

import com.ragpipe.protocol.WorkerMetadataDocument;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves a worker's self-description for discovery: {@code GET /metadata} returns the metadata document,
 * {@code GET /health} returns {@code {"status":"healthy"}}.
 */
public final class WorkerMetadataServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerMetadataServer.class);

    public static final String METADATA_PATH = "/metadata";
    public static final String HEALTH_PATH = "/health";
    static final String HEALTH_BODY = "{\"status\":\"healthy\"}";

    private final HttpServer server;
    private final ExecutorService executor;
    private final String serviceName;

    private WorkerMetadataServer(HttpServer server, ExecutorService executor, String serviceName) {
        this.server = server;
        this.executor = executor;
        this.serviceName = serviceName;
    }

    /**
     * Binds all interfaces on {@code port} (0 picks a free port) and starts serving.
     */
    public static WorkerMetadataServer start(WorkerMetadataDocument document, int port) throws IOException {
        Objects.requireNonNull(document, "document");
        String body = document.toJson();
        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext(METADATA_PATH, exchange -> respond(exchange, body));
        server.createContext(HEALTH_PATH, exchange -> respond(exchange, HEALTH_BODY));
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metadata-" + document.getServiceName());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        log.info("Metadata server for {} started on port {}", document.getServiceName(), server.getAddress().getPort());
        return new WorkerMetadataServer(server, executor, document.getServiceName());
    }

    private static void respond(HttpExchange exchange, String body) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("Metadata server for {} stopped", serviceName);
    }
}
