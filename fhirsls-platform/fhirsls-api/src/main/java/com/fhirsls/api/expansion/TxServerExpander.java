package com.fhirsls.api.expansion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fhirsls.core.fhir.FhirTerms;
import com.fhirsls.core.rules.ExpansionResult;
import com.fhirsls.core.rules.SourceExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Expands ValueSet definitions through a FHIR terminology server's {@code ValueSet/$expand} operation.
 *
 * The definition is posted as {@code Parameters{valueSet}}. The server may answer with the
 * expanded ValueSet itself or with a Parameters resource whose {@code return} holds it.
 * Any other answer is a failure for that source only.
 */
public class TxServerExpander implements SourceExpander {

    private static final Logger log = LoggerFactory.getLogger(TxServerExpander.class);

    private final URI expandUri;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public TxServerExpander(String baseUrl, ObjectMapper objectMapper, Duration connectTimeout, Duration requestTimeout) {
        Objects.requireNonNull(baseUrl, "Base URL cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.expandUri = URI.create(trimmed + "/ValueSet/$expand");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Objects.requireNonNull(connectTimeout, "Connect timeout cannot be null"))
                .build();
    }

    @Override
    public ExpansionResult expand(JsonNode valueSet) {
        String id = valueSet.path("id").asText("unknown");

        String body;
        try {
            body = objectMapper.writeValueAsString(parameters(valueSet));
        } catch (JsonProcessingException e) {
            return ExpansionResult.failure("Could not serialize ValueSet " + id + ": " + e.getOriginalMessage());
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(expandUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/fhir+json")
                .header("Accept", "application/fhir+json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Expansion request for ValueSet {} failed: {}", id, e.getMessage());
            return ExpansionResult.failure("Terminology server unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExpansionResult.failure("Expansion interrupted");
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.warn("Terminology server answered {} for ValueSet {}", response.statusCode(), id);
            return ExpansionResult.failure("Terminology server returned HTTP " + response.statusCode());
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            return ExpansionResult.failure("Terminology server returned malformed JSON");
        }

        JsonNode expanded = unwrap(payload);
        if (expanded == null) {
            return ExpansionResult.failure("Terminology server response holds no expanded ValueSet");
        }
        log.debug("Expanded ValueSet {} via {}", id, expandUri);
        return ExpansionResult.success(expanded);
    }

    private ObjectNode parameters(JsonNode valueSet) {
        ObjectNode parameters = objectMapper.createObjectNode();
        parameters.put(FhirTerms.RESOURCE_TYPE, FhirTerms.PARAMETERS);
        ObjectNode parameter = parameters.putArray("parameter").addObject();
        parameter.put("name", "valueSet");
        parameter.set("resource", valueSet);
        return parameters;
    }

    private static JsonNode unwrap(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return null;
        }
        String type = payload.path(FhirTerms.RESOURCE_TYPE).asText();
        if (FhirTerms.VALUE_SET.equals(type)) {
            return payload.path("expansion").isObject() ? payload : null;
        }
        if (FhirTerms.PARAMETERS.equals(type)) {
            for (JsonNode parameter : payload.path("parameter")) {
                if ("return".equals(parameter.path("name").asText())) {
                    return unwrap(parameter.path("resource"));
                }
            }
        }
        return null;
    }

    public URI expandUri() {
        return expandUri;
    }
}
