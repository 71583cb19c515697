package com.codereview.orchestrator.api;

import com.codereview.orchestrator.broker.MessageSink;
import com.codereview.orchestrator.broker.ProgressBroker;
import com.codereview.orchestrator.broker.ProgressEvent;
import com.codereview.orchestrator.store.TaskStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint {@code /ws/review/{taskId}}.
 *
 * Each connection becomes one broker subscriber, keyed by the session id.
 * Clients keep the subscription alive by sending {@code ping} (plain text)
 * or {@code {"type":"ping"}}; both are answered with a pong and count as a
 * heartbeat.
 */
@Component
public class ProgressWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ProgressWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT  = 512 * 1024;

    private final ProgressBroker broker;
    private final TaskStore      store;
    private final ObjectMapper   objectMapper;

    // session id -> decorated session, so replies and broadcasts share one send path
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public ProgressWebSocketHandler(ProgressBroker broker, TaskStore store, ObjectMapper objectMapper) {
        this.broker       = broker;
        this.store        = store;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Optional<UUID> taskId = taskIdOf(session.getUri());
        if (taskId.isEmpty()) {
            log.warn("Rejecting WebSocket {}: no valid task id in {}", session.getId(), session.getUri());
            session.close(CloseStatus.BAD_DATA.withReason("Invalid task id"));
            return;
        }
        if (store.get(taskId.get()).isEmpty()) {
            log.warn("Rejecting WebSocket {}: unknown task {}", session.getId(), taskId.get());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown task"));
            return;
        }

        WebSocketSession concurrent =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessions.put(session.getId(), concurrent);
        broker.register(taskId.get(), session.getId(), new SessionSink(concurrent, objectMapper));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        Optional<UUID> taskId = taskIdOf(session.getUri());
        WebSocketSession out = sessions.get(session.getId());
        if (taskId.isEmpty() || out == null) {
            return;
        }

        String payload = message.getPayload().trim();
        if ("ping".equalsIgnoreCase(payload)) {
            broker.touch(taskId.get(), session.getId());
            out.sendMessage(new TextMessage("pong"));
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON from WebSocket {}: {}", session.getId(), e.getOriginalMessage());
            out.sendMessage(frame(Map.of("type", "error", "message", "Invalid JSON")));
            return;
        }

        String type = node.path("type").asText("");
        if ("ping".equals(type)) {
            broker.touch(taskId.get(), session.getId());
            out.sendMessage(frame(Map.of("type", "pong")));
        } else {
            log.debug("Ignoring '{}' message from WebSocket {}", type, session.getId());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on WebSocket {}: {}", session.getId(), exception.getMessage());
        detach(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("WebSocket {} closed with {}", session.getId(), status);
        detach(session);
    }

    private void detach(WebSocketSession session) {
        sessions.remove(session.getId());
        taskIdOf(session.getUri()).ifPresent(id -> broker.unregister(id, session.getId()));
    }

    private TextMessage frame(Map<String, String> body) throws JsonProcessingException {
        return new TextMessage(objectMapper.writeValueAsString(body));
    }

    /** The task id is the last path segment of the connection URI. */
    static Optional<UUID> taskIdOf(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return Optional.empty();
        }
        String path = uri.getPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        try {
            return Optional.of(UUID.fromString(last));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** Broker-facing view of one connection. */
    private static final class SessionSink implements MessageSink {
        private final WebSocketSession session;
        private final ObjectMapper     objectMapper;

        SessionSink(WebSocketSession session, ObjectMapper objectMapper) {
            this.session      = session;
            this.objectMapper = objectMapper;
        }

        @Override
        public void send(ProgressEvent event) throws IOException {
            if (!session.isOpen()) {
                throw new IOException("session " + session.getId() + " is closed");
            }
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(event)));
        }

        @Override
        public void close() throws IOException {
            if (session.isOpen()) {
                session.close(CloseStatus.GOING_AWAY);
            }
        }
    }
}
