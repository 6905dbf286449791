package com.astroinsight.astroinsight_backend.config;

import com.astroinsight.astroinsight_backend.engine.RedisEventBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/** Multi-instance event relay. Off by default; a single instance publishes straight to its broker. */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "agent.events.redis", name = "enabled", havingValue = "true")
public class RedisEventConfig {

    @Bean
    public RedisEventBridge redisEventBridge(StringRedisTemplate redisTemplate,
                                             SimpMessagingTemplate messagingTemplate,
                                             ObjectMapper objectMapper) {
        log.info("Session events relayed through Redis channel {}", RedisEventBridge.REDIS_CHANNEL);
        return new RedisEventBridge(redisTemplate, messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer redisEventListenerContainer(RedisConnectionFactory connectionFactory,
                                                                     RedisEventBridge bridge) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(bridge, new ChannelTopic(RedisEventBridge.REDIS_CHANNEL));
        return container;
    }
}
