package com.ragpipe.discovery;

import com.ragpipe.config.WorkerEndpoint;
import com.ragpipe.protocol.WorkerMetadataDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/** GETs {@code http://host:port/metadata}. Every failure is logged and reported as empty. */
public final class HttpWorkerMetadataClient implements WorkerMetadataClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerMetadataClient.class);

    public static final String METADATA_PATH = "/metadata";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpWorkerMetadataClient() {
        this(DEFAULT_TIMEOUT);
    }

    public HttpWorkerMetadataClient(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public Optional<WorkerMetadataDocument> fetch(WorkerEndpoint endpoint) {
        URI uri = URI.create(endpoint.baseUrl() + METADATA_PATH);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.info("Worker metadata unavailable at {}: {}", uri, e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while fetching worker metadata from {}", uri);
            return Optional.empty();
        }
        if (response.statusCode() != 200) {
            log.info("Worker metadata at {} returned HTTP {}", uri, response.statusCode());
            return Optional.empty();
        }
        WorkerMetadataDocument doc;
        try {
            doc = WorkerMetadataDocument.fromJson(response.body());
        } catch (IOException e) {
            log.warn("Worker metadata at {} is not valid JSON: {}", uri, e.getMessage());
            return Optional.empty();
        }
        if (doc.getActivities() == null) {
            log.warn("Worker metadata at {} has no 'activities'; skipping", uri);
            return Optional.empty();
        }
        return Optional.of(doc);
    }
}
