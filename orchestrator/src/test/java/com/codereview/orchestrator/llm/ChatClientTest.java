package com.codereview.orchestrator.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatClientTest {

    final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void complete_withoutApiKey_failsBeforeAnyRequest() {
        ChatClient client = new ChatClient("https://api.deepseek.com/", "", "deepseek-coder",
                0.1, 4000, Duration.ofSeconds(5), objectMapper);

        assertThatThrownBy(() -> client.complete("system", "user"))
                .isInstanceOf(ChatApiException.class)
                .satisfies(e -> assertThat(((ChatApiException) e).statusCode()).isEqualTo(401));
    }

    @Test
    void completionResponse_readsFirstChoiceAndIgnoresExtraFields() throws Exception {
        String body = """
                {"id":"cmpl-1","object":"chat.completion",
                 "choices":[{"index":0,"finish_reason":"stop",
                             "message":{"role":"assistant","content":"QUALITY_SCORE: 8"}}],
                 "usage":{"total_tokens":12}}
                """;

        ChatClient.CompletionResponse response = objectMapper.readValue(body, ChatClient.CompletionResponse.class);

        assertThat(response.firstText()).isEqualTo("QUALITY_SCORE: 8");
    }

    @Test
    void completionResponse_noChoices_throws() {
        ChatClient.CompletionResponse empty = new ChatClient.CompletionResponse(List.of());

        assertThatThrownBy(empty::firstText).isInstanceOf(IllegalStateException.class);
    }
}
