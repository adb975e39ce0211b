package com.virtualsol.discovery.modules.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Optional;

/**
 * Fallback provider beans, used when no client implementation is on the context.
 */
@Slf4j
@Configuration
public class ProviderDefaultsConfig {

    @Bean
    @ConditionalOnMissingBean
    public HealthDataProvider healthDataProvider() {
        log.info("No HealthDataProvider configured, health enrichment disabled");
        return mint -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public OnChainMetadataProvider onChainMetadataProvider() {
        log.info("No OnChainMetadataProvider configured, on-chain metadata enrichment disabled");
        return mint -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public MarketMetadataProvider marketMetadataProvider() {
        log.info("No MarketMetadataProvider configured, market enrichment disabled");
        return (mint, logoUri) -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public HolderCountProvider holderCountProvider() {
        log.info("No HolderCountProvider configured, holder counts will not refresh");
        return mint -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public SolPriceProvider solPriceProvider(StringRedisTemplate redisTemplate) {
        return new RedisSolPriceProvider(redisTemplate);
    }
}
