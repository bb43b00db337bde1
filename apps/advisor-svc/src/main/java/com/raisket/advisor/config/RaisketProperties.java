package com.raisket.advisor.config;

import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "raisket")
public record RaisketProperties(Ai ai) {

    @ConstructorBinding
    public RaisketProperties {
        if (ai == null) {
            throw new IllegalArgumentException("ai configuration must be provided");
        }
    }

    public record Ai(
            String provider,
            String model,
            String endpoint,
            String apiKey,
            Integer timeoutMs,
            Integer maxOutputTokens
    ) {
        private static final int DEFAULT_TIMEOUT_MS = 15_000;
        private static final int MAX_TIMEOUT_MS = 120_000;
        private static final int DEFAULT_MAX_OUTPUT_TOKENS = 600;
        static final String OPENAI_DEFAULT_ENDPOINT = "https://api.openai.com/v1/responses";
        static final String ANTHROPIC_DEFAULT_ENDPOINT = "https://api.anthropic.com/v1/messages";

        public Ai {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("model must be provided");
            }
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            // apiKey may be blank; narratives then fall back to the fixed message without calling out
        }

        public String providerOrDefault() {
            return (provider != null && !provider.isBlank()) ? provider.trim().toLowerCase(Locale.ROOT) : "openai";
        }

        public String endpointOrDefault() {
            boolean anthropic = "anthropic".equals(providerOrDefault());
            String base = endpoint;
            if (base == null || base.isBlank() || (anthropic && base.contains("api.openai.com"))) {
                base = anthropic ? ANTHROPIC_DEFAULT_ENDPOINT : OPENAI_DEFAULT_ENDPOINT;
            }
            return base.trim();
        }

        public int timeoutOrDefault() {
            return timeoutMs == null ? DEFAULT_TIMEOUT_MS : Math.min(timeoutMs, MAX_TIMEOUT_MS);
        }

        public int maxOutputTokensOrDefault() {
            return (maxOutputTokens == null || maxOutputTokens <= 0) ? DEFAULT_MAX_OUTPUT_TOKENS : maxOutputTokens;
        }
    }
}
