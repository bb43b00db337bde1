package com.raisket.advisor.ai;

import com.raisket.advisor.config.RaisketProperties;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns a prompt into advisory text. The call is bounded by the configured timeout and never fails: any
 * problem yields {@link #FALLBACK_NARRATIVE}.
 */
@Service
public class NarrativeService {

    private static final Logger log = LoggerFactory.getLogger(NarrativeService.class);

    public static final String FALLBACK_NARRATIVE =
            "(Fallback) The advisory summary is not available right now. The figures above are complete and up to date.";

    private final AiTextClient aiTextClient;
    private final Executor executor;
    private final long timeoutMs;
    private final int maxOutputTokens;

    private volatile boolean apiKeyWarned = false;

    public NarrativeService(
            AiTextClient aiTextClient,
            RaisketProperties properties,
            @Qualifier(AiConfig.NARRATIVE_EXECUTOR) Executor executor) {
        this.aiTextClient = aiTextClient;
        this.executor = executor;
        this.timeoutMs = properties.ai().timeoutOrDefault();
        this.maxOutputTokens = properties.ai().maxOutputTokensOrDefault();
    }

    public record Narrative(String text, boolean generated) {

        static Narrative fallback() {
            return new Narrative(FALLBACK_NARRATIVE, false);
        }
    }

    public Narrative narrate(String prompt) {
        if (!aiTextClient.hasCredentials()) {
            if (!apiKeyWarned) {
                log.warn("Narrative: AI API key missing, using fallback (this warning is printed once)");
                apiKeyWarned = true;
            }
            return Narrative.fallback();
        }
        List<AiTextClient.Message> messages = List.of(
                new AiTextClient.Message("system", NarrativePrompts.SYSTEM_PROMPT),
                new AiTextClient.Message("user", prompt));
        CompletableFuture<Optional<String>> call = CompletableFuture.supplyAsync(
                () -> aiTextClient.generateText(messages, maxOutputTokens), executor);
        try {
            Optional<String> text = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (text.isPresent() && !text.get().isBlank()) {
                return new Narrative(text.get().trim(), true);
            }
            log.warn("Narrative: model returned no content, using fallback");
        } catch (TimeoutException ex) {
            call.cancel(true);
            log.warn("Narrative: no response within {} ms, using fallback", timeoutMs);
        } catch (ExecutionException ex) {
            log.warn("Narrative: generation failed, using fallback", ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Narrative: interrupted while waiting for the model, using fallback");
        }
        return Narrative.fallback();
    }
}
