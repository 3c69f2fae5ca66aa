package com.fhirsls.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * HTTP client for the FHIR Security Labeling Service.
 *
 * Bodies are exchanged as Jackson trees so callers can hand over FHIR JSON from any source.
 * Error responses are returned, not thrown; only transport failures raise exceptions.
 */
public class FhirSlsClient implements AutoCloseable {

    private final String baseUrl;
    private final String clientId;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private FhirSlsClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.clientId = builder.clientId;
        this.requestTimeout = Duration.ofSeconds(builder.requestTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(builder.connectTimeoutSeconds))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Rules ====================

    /**
     * Loads a ValueSet or a Bundle of ValueSets. The body is an OperationOutcome.
     */
    public SlsResponse<JsonNode> loadValueSets(JsonNode valueSets) throws IOException, InterruptedException {
        return post("/api/v1/valuesets", valueSets);
    }

    // ==================== Labeling ====================

    /**
     * Labels a bundle and returns a batch of updates for the analyzed records.
     */
    public SlsResponse<JsonNode> analyze(JsonNode bundle) throws IOException, InterruptedException {
        return post("/api/v1/analyze", bundle);
    }

    /**
     * Labels a bundle and returns all of it.
     */
    public SlsResponse<JsonNode> analyzeFull(JsonNode bundle) throws IOException, InterruptedException {
        return post("/api/v1/analyze-full", bundle);
    }

    // ==================== Administration ====================

    public SlsResponse<JsonNode> status() throws IOException, InterruptedException {
        return send(request("/api/v1/status").GET().build());
    }

    public SlsResponse<JsonNode> clearData() throws IOException, InterruptedException {
        return send(request("/api/v1/data").DELETE().build());
    }

    public SlsResponse<JsonNode> health() throws IOException, InterruptedException {
        return send(request("/api/v1/health").GET().build());
    }

    // ==================== HTTP Methods ====================

    private SlsResponse<JsonNode> post(String path, JsonNode body) throws IOException, InterruptedException {
        Objects.requireNonNull(body, "Body cannot be null");
        HttpRequest request = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        return send(request);
    }

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (clientId != null) {
            builder.header("X-Client-ID", clientId);
        }
        return builder;
    }

    private SlsResponse<JsonNode> send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String text = response.body();
        JsonNode body = text == null || text.isBlank() ? MissingNode.getInstance() : objectMapper.readTree(text);
        return new SlsResponse<>(response.statusCode(), body);
    }

    @Override
    public void close() {
        // HttpClient holds no resources that need releasing on JDK 17
    }

    // ==================== Builder ====================

    public static class Builder {
        private String baseUrl = "http://localhost:3000";
        private String clientId;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 60;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Identifies this caller to the service's rate limiter.
         */
        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder connectTimeout(int seconds) {
            this.connectTimeoutSeconds = seconds;
            return this;
        }

        public Builder requestTimeout(int seconds) {
            this.requestTimeoutSeconds = seconds;
            return this;
        }

        public FhirSlsClient build() {
            Objects.requireNonNull(baseUrl, "Base URL is required");
            return new FhirSlsClient(this);
        }
    }
}
