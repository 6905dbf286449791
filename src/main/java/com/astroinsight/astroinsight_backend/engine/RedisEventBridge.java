package com.astroinsight.astroinsight_backend.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Relays session events through Redis Pub/Sub so every instance delivers them.
 * A dispatch may run on instance A while the client's WebSocket is held by instance B;
 * each instance listens on the channel and forwards to its own broker.
 *
 * Created by {@link com.astroinsight.astroinsight_backend.config.RedisEventConfig} only when
 * {@code agent.events.redis.enabled=true}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisEventBridge implements MessageListener {

    public static final String REDIS_CHANNEL = "astroinsight:session:events";

    private final StringRedisTemplate   redisTemplate;
    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper          objectMapper;

    public void publish(String destination, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(new RelayedEvent(destination, payload));
            redisTemplate.convertAndSend(REDIS_CHANNEL, json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize session event for {}", destination, e);
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        try {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            RelayedEvent event = objectMapper.readValue(body, RelayedEvent.class);
            messagingTemplate.convertAndSend(event.destination(), event.payload());
        } catch (Exception e) {
            log.error("Failed to forward Redis message to WebSocket", e);
        }
    }

    public record RelayedEvent(String destination, Map<String, Object> payload) {}
}
