package com.ragpipe.activity.embedding;

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
 * {@link Embedder} that calls Ollama {@code /api/embed} (default http://localhost:11434, model nomic-embed-text).
 * All texts go in one request.
 */
public final class OllamaEmbedder implements Embedder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;

    public OllamaEmbedder(String baseUrl, String model) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:11434";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = model != null && !model.isBlank() ? model.trim() : "nomic-embed-text";
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public OllamaEmbedder() {
        this("http://localhost:11434", "nomic-embed-text");
    }

    @Override
    public List<float[]> embed(List<String> texts) throws Exception {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        Map<String, Object> reqBody = new HashMap<>();
        reqBody.put("model", model);
        reqBody.put("input", texts);
        String json = MAPPER.writeValueAsString(reqBody);

        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/api/embed"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(60))
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new RuntimeException("Ollama embed API error: " + response.statusCode() + " " + response.body());
        }

        List<float[]> embeddings = parseEmbeddings(MAPPER.readTree(response.body()));
        if (embeddings.size() != texts.size()) {
            throw new RuntimeException("Ollama returned " + embeddings.size() + " embeddings for " + texts.size() + " texts");
        }
        return embeddings;
    }

    static List<float[]> parseEmbeddings(JsonNode root) {
        List<float[]> embeddings = new ArrayList<>();
        JsonNode embNode = root.path("embeddings");
        if (embNode.isArray()) {
            for (JsonNode arr : embNode) {
                if (arr.isArray()) {
                    float[] vec = new float[arr.size()];
                    for (int i = 0; i < arr.size(); i++) vec[i] = (float) arr.get(i).asDouble(0);
                    embeddings.add(vec);
                }
            }
        }
        return embeddings;
    }

    @Override
    public String modelName() {
        return model;
    }
}
