package com.virtualsol.discovery.modules.providers;

import com.virtualsol.discovery.util.RedisKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Reads the SOL/USD price the price service publishes at {@code price:SOL}.
 */
@Slf4j
public class RedisSolPriceProvider implements SolPriceProvider {

    private final StringRedisTemplate redisTemplate;

    public RedisSolPriceProvider(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<BigDecimal> getSolPriceUsd() {
        try {
            String raw = redisTemplate.opsForValue().get(RedisKeys.SOL_PRICE);
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            BigDecimal price = new BigDecimal(raw.trim());
            return price.signum() > 0 ? Optional.of(price) : Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("Unparseable SOL price in {}", RedisKeys.SOL_PRICE);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("SOL price lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
