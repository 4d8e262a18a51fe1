package com.docweaver.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpAgentBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/agent", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            exchange.getResponseBody().write(bytes);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private HttpAgentBackend backend() {
        var uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/agent");
        return new HttpAgentBackend(AgentRole.RESEARCH, uri, Duration.ofSeconds(5), objectMapper);
    }

    private final AgentRequest request = new AgentRequest(AgentRole.RESEARCH, "DOC-2026-abc", "research-1",
            Map.of("question", "What is solar power?"));

    @Test
    @DisplayName("posts the envelope and returns the output object")
    void postsEnvelope() throws Exception {
        responseBody = """
                {"output": {"notes": [{"source": "s", "content": "c"}]}}
                """;

        var response = backend().call(request).join();

        assertEquals("research-1", response.unitId());
        assertTrue(response.output().containsKey("notes"));
        var sent = objectMapper.readTree(lastBody.get());
        assertEquals("research", sent.get("role").asText());
        assertEquals("DOC-2026-abc", sent.get("task_id").asText());
        assertEquals("research-1", sent.get("unit_id").asText());
        assertEquals("What is solar power?", sent.get("input").get("question").asText());
    }

    @Test
    @DisplayName("non-2xx status fails with HttpAgentException")
    void non2xx() {
        status = 429;
        responseBody = "{\"error\":\"slow down\"}";

        var ex = assertThrows(CompletionException.class, () -> backend().call(request).join());
        var http = assertInstanceOf(HttpAgentException.class, ex.getCause());
        assertEquals(429, http.statusCode());
    }

    @Test
    @DisplayName("response without an output object fails as malformed")
    void missingOutput() {
        responseBody = "{\"result\": 1}";

        var ex = assertThrows(CompletionException.class, () -> backend().call(request).join());
        assertInstanceOf(JsonProcessingException.class, AgentErrorClassifier.unwrap(ex));
    }
}
