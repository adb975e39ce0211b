package com.virtualsol.discovery.modules.providers;

import com.virtualsol.discovery.util.MintValidator;
import com.virtualsol.discovery.util.RedisKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Token prices the price service caches at {@code price:<mint>}.
 */
@Slf4j
@Component
@Order(1)
public class RedisTokenPriceProvider implements TokenPriceProvider {

    private final StringRedisTemplate redisTemplate;

    public RedisTokenPriceProvider(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<BigDecimal> getPriceUsd(String mint) {
        try {
            String raw = redisTemplate.opsForValue().get(RedisKeys.price(mint));
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            BigDecimal price = new BigDecimal(raw.trim());
            return price.signum() > 0 ? Optional.of(price) : Optional.empty();
        } catch (NumberFormatException | DataAccessException e) {
            log.debug("Cached price lookup failed for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
            return Optional.empty();
        }
    }
}
