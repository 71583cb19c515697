package com.codereview.orchestrator.llm;

/**
 * The chat-completions endpoint returned an error or could not be reached.
 */
public class ChatApiException extends RuntimeException {

    private final int statusCode;

    public ChatApiException(int statusCode, String body) {
        super("Chat API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public ChatApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int statusCode() { return statusCode; }
}
