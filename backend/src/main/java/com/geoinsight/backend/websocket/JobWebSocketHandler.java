package com.geoinsight.backend.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only event stream for a single analysis job at
 * {@code /ws/analyses/{jobId}}.
 */
@Component
public class JobWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(JobWebSocketHandler.class);

    private final ObjectMapper objectMapper;

    // jobId -> sessionId -> session
    private final Map<String, Map<String, WebSocketSession>> jobSessions = new ConcurrentHashMap<>();

    public JobWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String jobId = extractJobId(session);
        if (jobId != null) {
            jobSessions.computeIfAbsent(jobId, k -> new ConcurrentHashMap<>())
                    .put(session.getId(), session);
            log.info("WebSocket connected for job: {} session: {}", jobId, session.getId());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String jobId = extractJobId(session);
        if (jobId != null) {
            jobSessions.computeIfPresent(jobId, (id, sessions) -> {
                sessions.remove(session.getId());
                return sessions.isEmpty() ? null : sessions;
            });
            log.info("WebSocket disconnected for job: {} session: {}", jobId, session.getId());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring client message on session {}: {}", session.getId(), message.getPayload());
    }

    public int sessionCount(String jobId) {
        Map<String, WebSocketSession> sessions = jobSessions.get(jobId);
        return sessions == null ? 0 : sessions.size();
    }

    /**
     * Send a message to every local session watching the job.
     */
    public void broadcast(String jobId, WebSocketMessage message) {
        var sessions = jobSessions.get(jobId);
        if (sessions == null || sessions.isEmpty()) {
            return;
        }

        TextMessage textMessage;
        try {
            textMessage = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message for job: {}", message.getType(), jobId, e);
            return;
        }

        sessions.values().forEach(session -> {
            try {
                if (session.isOpen()) {
                    synchronized (session) {
                        session.sendMessage(textMessage);
                    }
                }
            } catch (IOException e) {
                log.error("Failed to send WebSocket message to session: {}", session.getId(), e);
            }
        });
    }

    private String extractJobId(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null) {
            return null;
        }
        // Path format: /ws/analyses/{jobId}
        String[] parts = uri.getPath().split("/");
        if (parts.length >= 4 && "analyses".equals(parts[2])) {
            return parts[3];
        }
        return null;
    }
}
