package com.raisket.advisor.ai;

import static org.junit.jupiter.api.Assertions.*;

import com.raisket.advisor.config.RaisketProperties;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Exercises both provider payloads against an embedded HttpServer.
 */
class AiTextClientTest {

    static com.sun.net.httpserver.HttpServer server;
    static int port;

    static final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    static final AtomicReference<String> lastApiKey = new AtomicReference<>();
    static final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeAll
    static void start() throws IOException {
        server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/v1/responses", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\n" +
                    "  \"id\": \"resp_1\",\n" +
                    "  \"output\": [{\"type\": \"message\", \"content\": [{\"type\": \"output_text\", \"text\": \"Save first.\"}]}]\n" +
                    "}");
        });
        server.createContext("/v1/messages", exchange -> {
            lastApiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"content\": [{\"type\": \"text\", \"text\": \"Pay the card.\"}]}");
        });
        server.createContext("/broken", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respond(exchange, 500, "{\"error\": \"overloaded\"}");
        });
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    @BeforeEach
    void reset() {
        lastAuthorization.set(null);
        lastApiKey.set(null);
        lastBody.set(null);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private AiTextClient newClient(String provider, String path) {
        return new AiTextClient(new RaisketProperties(new RaisketProperties.Ai(
                provider, "model-x", "http://localhost:" + port + path, "test-key", 5_000, null)));
    }

    private static List<AiTextClient.Message> messages() {
        return List.of(
                new AiTextClient.Message("system", "You are an advisor."),
                new AiTextClient.Message("user", "Summarize my budget."));
    }

    @Test
    void openAiResponseTextIsExtracted() {
        AiTextClient client = newClient("openai", "/v1/responses");

        Optional<String> text = client.generateText(messages(), 200);

        assertEquals(Optional.of("Save first."), text);
        assertEquals("Bearer test-key", lastAuthorization.get());
        assertTrue(lastBody.get().contains("\"max_output_tokens\":200"));
        assertTrue(lastBody.get().contains("\"model\":\"model-x\""));
    }

    @Test
    void anthropicSendsSystemSeparately() {
        AiTextClient client = newClient("anthropic", "/v1/messages");

        Optional<String> text = client.generateText(messages(), null);

        assertEquals(Optional.of("Pay the card."), text);
        assertEquals("test-key", lastApiKey.get());
        assertTrue(lastBody.get().contains("\"system\":\"You are an advisor.\""));
        assertTrue(lastBody.get().contains("\"max_tokens\":600"));
        assertFalse(lastBody.get().contains("\"role\":\"system\""));
    }

    @Test
    void serverErrorYieldsEmpty() {
        AiTextClient client = newClient("openai", "/broken");

        assertTrue(client.generateText(messages(), 100).isEmpty());
    }

    @Test
    void configuredKeyCountsAsCredentials() {
        AiTextClient client = newClient("openai", "/v1/responses");

        assertTrue(client.hasCredentials());
        assertEquals(AiTextClient.Provider.OPENAI, client.provider());
    }
}
