package com.geoinsight.backend.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.model.JobStatus;
import com.geoinsight.backend.model.SubtaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.stereotype.Component;

/**
 * Fans job events out to every backend instance through Redis Pub/Sub.
 * Publishing is best effort: a Redis outage is logged and never fails the
 * analysis.
 */
@Component
public class JobEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JobEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ChannelTopic jobEventsTopic;

    public JobEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ChannelTopic jobEventsTopic) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.jobEventsTopic = jobEventsTopic;
    }

    public void publishStatusChange(String jobId, JobStatus status, String error) {
        publish(JobEvent.statusChanged(jobId, status, error));
    }

    public void publishSubtaskCompleted(String jobId, String subtask, SubtaskOutcome outcome) {
        publish(JobEvent.subtaskCompleted(jobId, subtask, outcome));
    }

    void publish(JobEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[PUB/SUB] Could not serialize {} event for job: {}", event.type(), event.jobId(), e);
            return;
        }
        try {
            redisTemplate.convertAndSend(jobEventsTopic.getTopic(), json);
            log.debug("[PUB/SUB] Published {} event for job: {}", event.type(), event.jobId());
        } catch (RuntimeException e) {
            log.error("[PUB/SUB] Failed to publish {} event for job: {}", event.type(), event.jobId(), e);
        }
    }
}
