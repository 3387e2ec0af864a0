package com.geoinsight.backend.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.websocket.JobWebSocketHandler;
import com.geoinsight.backend.websocket.WebSocketMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Receives job events from Redis Pub/Sub and hands them to the WebSocket
 * sessions connected to this instance.
 */
@Component
public class JobEventSubscriber {

    private static final Logger log = LoggerFactory.getLogger(JobEventSubscriber.class);

    private final ObjectMapper objectMapper;
    private final JobWebSocketHandler jobWebSocketHandler;

    public JobEventSubscriber(ObjectMapper objectMapper, JobWebSocketHandler jobWebSocketHandler) {
        this.objectMapper = objectMapper;
        this.jobWebSocketHandler = jobWebSocketHandler;
    }

    /**
     * Called by Spring's MessageListenerAdapter.
     */
    public void handleMessage(String message) {
        JobEvent event;
        try {
            event = objectMapper.readValue(message, JobEvent.class);
        } catch (JsonProcessingException e) {
            log.error("[PUB/SUB] Dropping malformed message: {}", message, e);
            return;
        }
        if (event.jobId() == null || event.type() == null) {
            log.warn("[PUB/SUB] Dropping event without job id or type: {}", message);
            return;
        }

        log.debug("[PUB/SUB] Received {} event for job: {}", event.type(), event.jobId());
        jobWebSocketHandler.broadcast(event.jobId(), WebSocketMessage.from(event));
    }
}
