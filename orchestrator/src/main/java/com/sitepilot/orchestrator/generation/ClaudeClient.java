package com.sitepilot.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepilot.orchestrator.session.Cancellation;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * {@link CodeGenerationClient} over the Anthropic Messages API.
 *
 * Single-turn: one system prompt, one user message. Each HTTP call goes
 * through the {@code generation} Resilience4j {@link Retry}, which retries
 * rate-limit, overload and transport failures with exponential backoff.
 */
@Component
public class ClaudeClient implements CodeGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String stop_reason) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Concatenated text of every text block. */
        public String text() {
            if (content == null) return "";
            StringBuilder sb = new StringBuilder();
            for (ContentBlock b : content) {
                if ("text".equals(b.type()) && b.text() != null) sb.append(b.text());
            }
            return sb.toString();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String   API_URL      = "https://api.anthropic.com/v1/messages";
    private static final String   API_VER      = "2023-06-01";
    private static final int      MAX_TOKENS   = 16000;
    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(300);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;
    private final String       apiUrl;
    private final Retry        retry;

    @Autowired
    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.model}") String model,
                        ObjectMapper objectMapper,
                        Retry generationRetry) {
        this(apiKey, model, objectMapper, API_URL, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build(), generationRetry);
    }

    ClaudeClient(String apiKey, String model, ObjectMapper objectMapper, String apiUrl,
                 HttpClient http, Retry retry) {
        this.apiKey = apiKey;
        this.model  = model;
        this.json   = objectMapper;
        this.apiUrl = apiUrl;
        this.http   = http;
        this.retry  = retry;
        retry.getEventPublisher().onRetry(event ->
                log.warn("Claude call failed (attempt {}): {}; retrying in {}ms",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage(),
                        event.getWaitInterval().toMillis()));
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String generate(String systemPrompt, String prompt) {
        return complete(model, List.of(new Message("user", prompt)), systemPrompt);
    }

    /**
     * Send a conversation and return the assistant's text.
     *
     * @throws GenerationException after the last failed attempt
     * @throws java.util.concurrent.CancellationException if the thread is
     *         interrupted, including while waiting between attempts
     */
    public String complete(String model, List<Message> messages, String systemPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", MAX_TOKENS);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            body.put("system", systemPrompt);
        }
        body.put("messages", messages);

        String requestBody;
        try {
            requestBody = json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Could not serialize request", e);
        }

        try {
            return Retry.decorateSupplier(retry, () -> send(requestBody)).get();
        } catch (GenerationException e) {
            // An interrupt during the backoff ends the retries with the last failure.
            Cancellation.checkpoint();
            throw e;
        }
    }

    private String send(String requestBody) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .timeout(CALL_TIMEOUT)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for Claude");
        } catch (IOException e) {
            throw new GenerationException("Claude API call failed: " + e.getMessage(), e);
        }

        if (response.statusCode() != 200) {
            throw new GenerationException(response.statusCode(),
                    "Claude API error %d: %s".formatted(response.statusCode(), response.body()));
        }

        MessagesResponse parsed;
        try {
            parsed = json.readValue(response.body(), MessagesResponse.class);
        } catch (JsonProcessingException e) {
            throw new GenerationException("Unreadable Claude response", e);
        }
        String text = parsed.text();
        if (text.isBlank()) {
            throw new GenerationException(200, "No text block in Claude response");
        }
        if ("max_tokens".equals(parsed.stop_reason())) {
            log.warn("Claude reply hit the token limit; output may be truncated");
        }
        return text;
    }
}
