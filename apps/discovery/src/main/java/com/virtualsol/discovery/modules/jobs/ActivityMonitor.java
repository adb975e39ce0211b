package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.util.RedisKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Liveness signal written by the API process: {@code system:active_users} (connected users)
 * and {@code system:last_activity} (epoch millis of the last request).
 */
@Slf4j
@Component
public class ActivityMonitor {

    private final StringRedisTemplate redisTemplate;
    private final Duration idleThreshold;
    private final Clock clock;

    public ActivityMonitor(StringRedisTemplate redisTemplate, DiscoveryProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.idleThreshold = properties.getRetention().getIdleThreshold();
        this.clock = clock;
    }

    /**
     * True when someone is connected or was active within the idle threshold. Also true when
     * the signal cannot be read.
     */
    public boolean isActive() {
        try {
            Long activeUsers = parse(redisTemplate.opsForValue().get(RedisKeys.ACTIVE_USERS));
            if (activeUsers != null && activeUsers > 0) {
                return true;
            }
            Long lastActivity = parse(redisTemplate.opsForValue().get(RedisKeys.LAST_ACTIVITY));
            return lastActivity != null && clock.millis() - lastActivity < idleThreshold.toMillis();
        } catch (DataAccessException e) {
            log.warn("Activity check failed, assuming active: {}", e.getMessage());
            return true;
        }
    }

    private static Long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
