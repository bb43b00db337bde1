package com.raisket.advisor.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.raisket.advisor.config.RaisketProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin HTTP client for the text-generation providers (OpenAI Responses API, Anthropic Messages API).
 * Every failure is logged and reported as an empty result.
 */
@Component
public class AiTextClient {

    private static final Logger log = LoggerFactory.getLogger(AiTextClient.class);
    private static final String ANTHROPIC_VERSION = "2023-06-01";

    enum Provider { OPENAI, ANTHROPIC }

    private final RaisketProperties properties;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record OpenAiResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public AiTextClient(RaisketProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int timeoutMs = properties.ai().timeoutOrDefault();
        requestFactory.setConnectTimeout(Duration.ofMillis(Math.min(timeoutMs, 10_000)));
        requestFactory.setReadTimeout(Duration.ofMillis(timeoutMs));

        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("AI HTTP client configured: provider={} readTimeoutMs={}", provider(), timeoutMs);
    }

    public Optional<String> generateText(List<Message> messages, Integer maxOutputTokens) {
        int maxTokens = maxOutputTokens != null && maxOutputTokens > 0
                ? maxOutputTokens
                : properties.ai().maxOutputTokensOrDefault();
        return switch (provider()) {
            case OPENAI -> generateOpenAi(messages, maxTokens);
            case ANTHROPIC -> generateAnthropic(messages, maxTokens);
        };
    }

    public boolean hasCredentials() {
        return resolveApiKey().isPresent();
    }

    private Optional<String> generateOpenAi(List<Message> messages, int maxTokens) {
        Optional<String> apiKey = resolveApiKey();
        if (apiKey.isEmpty()) {
            return Optional.empty();
        }
        OpenAiResponsesRequest requestBody = new OpenAiResponsesRequest(properties.ai().model(), messages, maxTokens);
        try {
            JsonNode response = restClient.post()
                    .uri(properties.ai().endpointOrDefault())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey.get()))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response.get("output_text"));
            }
            return Optional.ofNullable(text).filter(s -> !s.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("OpenAI Responses call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("OpenAI Responses call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private Optional<String> generateAnthropic(List<Message> messages, int maxTokens) {
        Optional<String> apiKey = resolveApiKey();
        if (apiKey.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", properties.ai().model());
        payload.put("max_tokens", maxTokens);
        String system = collectSystemInstruction(messages);
        if (!system.isBlank()) {
            payload.put("system", system);
        }
        List<Message> conversation = new ArrayList<>();
        for (Message message : messages) {
            if (!"system".equalsIgnoreCase(message.role())) {
                conversation.add(message);
            }
        }
        payload.put("messages", conversation);
        try {
            JsonNode response = restClient.post()
                    .uri(properties.ai().endpointOrDefault())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-api-key", apiKey.get())
                    .header("anthropic-version", ANTHROPIC_VERSION)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(extractText(response.get("content"))).filter(s -> !s.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("Anthropic Messages call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("Anthropic Messages call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private String collectSystemInstruction(List<Message> messages) {
        StringBuilder system = new StringBuilder();
        for (Message message : messages) {
            if ("system".equalsIgnoreCase(message.role()) && message.content() != null) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.content());
            }
        }
        return system.toString();
    }

    private Optional<String> resolveApiKey() {
        String configured = properties.ai().apiKey();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured);
        }
        String envKey = System.getenv(provider() == Provider.ANTHROPIC ? "ANTHROPIC_API_KEY" : "OPENAI_API_KEY");
        if (envKey != null && !envKey.isBlank()) {
            return Optional.of(envKey);
        }
        return Optional.empty();
    }

    Provider provider() {
        return "anthropic".equals(properties.ai().providerOrDefault()) ? Provider.ANTHROPIC : Provider.OPENAI;
    }

    // both providers nest the text as arrays of {type, text} blocks, sometimes under "content"
    private String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        JsonNode text = node.get("text");
        if (text != null) {
            String nested = extractText(text);
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        JsonNode content = node.get("content");
        if (content != null) {
            return extractText(content);
        }
        return null;
    }
}
