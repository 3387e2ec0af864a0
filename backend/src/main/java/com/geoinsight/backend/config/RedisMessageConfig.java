package com.geoinsight.backend.config;

import com.geoinsight.backend.pubsub.JobEventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis Pub/Sub wiring: one channel carries the job events of every instance.
 */
@Configuration
public class RedisMessageConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisMessageConfig.class);

    @Bean
    public ChannelTopic jobEventsTopic(@Value("${geoinsight.events.channel:geoinsight:job-events}") String channel) {
        return new ChannelTopic(channel);
    }

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter jobEventListener,
            ChannelTopic jobEventsTopic) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(jobEventListener, jobEventsTopic);
        container.setErrorHandler(e -> log.error("[PUB/SUB] Job event listener failed", e));
        return container;
    }

    @Bean
    public MessageListenerAdapter jobEventListener(JobEventSubscriber subscriber) {
        MessageListenerAdapter adapter = new MessageListenerAdapter(subscriber, "handleMessage");
        adapter.setSerializer(new StringRedisSerializer());
        return adapter;
    }
}
