package com.virtualsol.discovery.modules.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes notifications as JSON onto a Redis list consumed by the notification service.
 */
@Slf4j
@Component
public class RedisNotificationPublisher implements NotificationPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String queueKey;

    public RedisNotificationPublisher(StringRedisTemplate redisTemplate,
                                      ObjectMapper objectMapper,
                                      DiscoveryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.queueKey = properties.getNotifications().getQueueKey();
    }

    @Override
    public void publish(TokenTransitionNotification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize notification for " + notification.getMint(), e);
        }
        redisTemplate.opsForList().leftPush(queueKey, payload);
        log.debug("Queued notification for user {} on {}", notification.getUserId(), queueKey);
    }
}
