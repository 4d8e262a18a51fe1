package com.docweaver.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link AgentBackend} that forwards a role invocation to an HTTP collaborator.
 *
 * <p>Request body: {@code {"role": ..., "task_id": ..., "unit_id": ..., "input": {...}}}.
 * Expected response: {@code {"output": {...}}}. Non-2xx statuses raise
 * {@link HttpAgentException}; classification into retryable or not happens in
 * {@link AgentErrorClassifier}.
 */
public class HttpAgentBackend implements AgentBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentBackend.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final int MAX_ERROR_BODY = 500;

    private final AgentRole role;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpAgentBackend(AgentRole role, URI endpoint, Duration requestTimeout, ObjectMapper objectMapper) {
        this(role, endpoint, requestTimeout, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), objectMapper);
    }

    HttpAgentBackend(AgentRole role, URI endpoint, Duration requestTimeout,
                     HttpClient httpClient, ObjectMapper objectMapper) {
        this.role = role;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<AgentResponse> call(AgentRequest request) {
        String body;
        try {
            body = toRequestBody(request);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        var httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("POST {} for unit {} [{}]", endpoint, request.unitId(), role.wireName());
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> toAgentResponse(request, response));
    }

    public AgentRole role() {
        return role;
    }

    public URI endpoint() {
        return endpoint;
    }

    private String toRequestBody(AgentRequest request) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", role.wireName());
        node.put("task_id", request.taskId());
        node.put("unit_id", request.unitId());
        node.set("input", objectMapper.valueToTree(request.input()));
        return objectMapper.writeValueAsString(node);
    }

    private AgentResponse toAgentResponse(AgentRequest request, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new HttpAgentException(status, "HTTP " + status + " from " + endpoint + ": "
                    + truncate(response.body()));
        }
        try {
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode output = root == null ? null : root.get("output");
            if (output == null || !output.isObject()) {
                throw new JsonMappingException((Closeable) null,
                        "Response from " + endpoint + " has no 'output' object");
            }
            Map<String, Object> payload = objectMapper.convertValue(output, MAP_TYPE);
            return new AgentResponse(role, request.unitId(), payload);
        } catch (JsonProcessingException e) {
            throw new CompletionException(e);
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
