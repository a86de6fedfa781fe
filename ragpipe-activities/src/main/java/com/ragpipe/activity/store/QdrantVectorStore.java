package com.ragpipe.activity.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorStore} over the Qdrant REST API (default http://localhost:6333).
 * Collections are created with cosine distance.
 */
public final class QdrantVectorStore implements VectorStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final String baseUrl;
    private final HttpClient httpClient;

    public QdrantVectorStore(String baseUrl) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:6333";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public QdrantVectorStore() {
        this("http://localhost:6333");
    }

    @Override
    public void ensureCollection(String collection, int dimension) throws Exception {
        Map<String, Object> body = Map.of(
                "vectors", Map.of("size", dimension, "distance", "Cosine")
        );
        HttpResponse<String> res = send(HttpRequest.newBuilder(uri("/collections/" + collection))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .PUT(json(body))
                .build());
        if (res.statusCode() == 200 || res.statusCode() == 201) return;
        if (res.statusCode() == 409) return; // already exists
        if (res.statusCode() == 400 && res.body() != null && res.body().contains("already exists")) return;
        throw new RuntimeException("Qdrant create collection failed: " + res.statusCode() + " " + res.body());
    }

    @Override
    public void upsert(String collection, List<VectorPoint> points) throws Exception {
        List<Map<String, Object>> payload = new ArrayList<>();
        for (VectorPoint p : points) {
            Map<String, Object> point = new HashMap<>();
            point.put("id", p.getId());
            point.put("vector", p.getVector());
            point.put("payload", p.getPayload());
            payload.add(point);
        }
        HttpResponse<String> res = send(HttpRequest.newBuilder(uri("/collections/" + collection + "/points?wait=true"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(60))
                .PUT(json(Map.of("points", payload)))
                .build());
        if (res.statusCode() != 200) {
            throw new RuntimeException("Qdrant upsert failed: " + res.statusCode() + " " + res.body());
        }
    }

    @Override
    public List<ScoredPoint> search(String collection, float[] vector, int limit) throws Exception {
        Map<String, Object> body = Map.of(
                "vector", vector,
                "limit", limit,
                "with_payload", true
        );
        HttpResponse<String> res = send(HttpRequest.newBuilder(uri("/collections/" + collection + "/points/search"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(30))
                .POST(json(body))
                .build());
        if (res.statusCode() != 200) {
            throw new RuntimeException("Qdrant search failed: " + res.statusCode() + " " + res.body());
        }
        return parseHits(MAPPER.readTree(res.body()).path("result"));
    }

    static List<ScoredPoint> parseHits(JsonNode result) {
        JsonNode hits = result.isArray() ? result : result.path("points");
        List<ScoredPoint> out = new ArrayList<>();
        if (!hits.isArray()) return out;
        for (JsonNode hit : hits) {
            Map<String, Object> payload = hit.has("payload") && hit.get("payload").isObject()
                    ? MAPPER.convertValue(hit.get("payload"), MAP_TYPE) : Map.of();
            out.add(new ScoredPoint(hit.path("id").asText(), hit.path("score").asDouble(0.0), payload));
        }
        return out;
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static HttpRequest.BodyPublisher json(Object body) throws Exception {
        return HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
    }

    private HttpResponse<String> send(HttpRequest request) throws Exception {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }
}
