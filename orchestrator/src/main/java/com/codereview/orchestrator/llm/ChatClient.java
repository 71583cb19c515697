package com.codereview.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around an OpenAI-compatible chat-completions endpoint
 * (DeepSeek by default).
 *
 * Uses java.net.http.HttpClient and Jackson directly so every header and
 * byte on the wire is visible when debugging a stage.
 */
@Component
public class ChatClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** One message of a conversation. role is "system", "user" or "assistant". */
    public record Message(String role, String content) {
        public static Message system(String content) { return new Message("system", content); }
        public static Message user(String content)   { return new Message("user", content); }
    }

    /** The subset of the API response we read. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompletionResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        public String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new IllegalStateException("No choices in completion response");
            }
            return choices.get(0).message().content();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final double       temperature;
    private final int          maxTokens;
    private final Duration     timeout;

    public ChatClient(@Value("${codereview.llm.base-url:https://api.deepseek.com}") String baseUrl,
                      @Value("${codereview.llm.api-key:}") String apiKey,
                      @Value("${codereview.llm.model:deepseek-coder}") String model,
                      @Value("${codereview.llm.temperature:0.1}") double temperature,
                      @Value("${codereview.llm.max-tokens:4000}") int maxTokens,
                      @Value("${codereview.llm.timeout:120s}") Duration timeout,
                      ObjectMapper objectMapper) {
        this.baseUrl     = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey      = apiKey;
        this.model       = model;
        this.temperature = temperature;
        this.maxTokens   = maxTokens;
        this.timeout     = timeout;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a system prompt plus one user message and return the reply text.
     *
     * @throws ChatApiException on a non-200 response
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public String complete(String systemPrompt, String userMessage) throws InterruptedException {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPrompt));
        messages.add(Message.user(userMessage));
        return complete(messages);
    }

    public String complete(List<Message> messages) throws InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ChatApiException(401, "codereview.llm.api-key is not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",       model);
            body.put("messages",    messages);
            body.put("temperature", temperature);
            body.put("max_tokens",  maxTokens);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(timeout)
                    .header("content-type",  "application/json")
                    .header("authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            long started = System.nanoTime();
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("Chat completion returned HTTP {} in {} ms",
                    response.statusCode(), (System.nanoTime() - started) / 1_000_000);

            if (response.statusCode() != 200) {
                throw new ChatApiException(response.statusCode(), response.body());
            }
            return json.readValue(response.body(), CompletionResponse.class).firstText();

        } catch (ChatApiException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new ChatApiException("Chat completion call failed", e);
        }
    }
}
