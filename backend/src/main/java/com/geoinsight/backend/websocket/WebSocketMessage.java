package com.geoinsight.backend.websocket;

import com.geoinsight.backend.model.JobEventType;
import com.geoinsight.backend.pubsub.JobEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frame pushed to clients watching a job on {@code /ws/analyses/{jobId}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    private JobEventType type;
    private String jobId;
    private long timestamp;
    private JobEvent event;

    public static WebSocketMessage from(JobEvent event) {
        return WebSocketMessage.builder()
                .type(event.type())
                .jobId(event.jobId())
                .timestamp(event.timestamp())
                .event(event)
                .build();
    }
}
