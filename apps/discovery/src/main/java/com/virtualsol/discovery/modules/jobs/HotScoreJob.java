package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.cache.TokenCacheManager;
import com.virtualsol.discovery.modules.tokens.enrich.TokenHealthEnricher;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recomputes hot scores for every live token and re-ranks the ones that moved.
 */
@Slf4j
@Component
public class HotScoreJob implements ScheduledJob {

    private static final Set<TokenState> RANKED_STATES =
            EnumSet.of(TokenState.LAUNCHING, TokenState.ABOUT_TO_BOND, TokenState.BONDED, TokenState.ACTIVE);
    private static final int PAGE_SIZE = 200;

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenHealthEnricher healthEnricher;
    private final TokenBufferManager bufferManager;
    private final TokenCacheManager cacheManager;
    private final Duration interval;

    public HotScoreJob(TokenDiscoveryRepository tokenRepository,
                       TokenHealthEnricher healthEnricher,
                       TokenBufferManager bufferManager,
                       TokenCacheManager cacheManager,
                       DiscoveryProperties properties) {
        this.tokenRepository = tokenRepository;
        this.healthEnricher = healthEnricher;
        this.bufferManager = bufferManager;
        this.cacheManager = cacheManager;
        this.interval = properties.getIntervals().getHotScoreUpdate();
    }

    @Override
    public String getName() {
        return "hot-score";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        int scanned = 0;
        int updated = 0;
        int page = 0;
        List<TokenDiscovery> tokens;
        do {
            tokens = tokenRepository.findByStateIn(RANKED_STATES,
                    PageRequest.of(page++, PAGE_SIZE, Sort.by("mint")));
            for (TokenDiscovery token : tokens) {
                scanned++;
                if (rescore(token)) {
                    updated++;
                }
            }
        } while (tokens.size() == PAGE_SIZE);

        log.info("Hot score update: {} of {} tokens changed", updated, scanned);
    }

    private boolean rescore(TokenDiscovery token) {
        try {
            BigDecimal score = BigDecimal.valueOf(healthEnricher.calculateHotScore(token));
            if (token.getHotScore() != null && token.getHotScore().compareTo(score) == 0) {
                return false;
            }
            bufferManager.bufferToken(BufferedTokenData.builder()
                    .mint(token.getMint())
                    .hotScore(score)
                    .build());
            cacheManager.cacheTokenRow(token.getMint());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to update hot score for {}", MintValidator.abbreviate(token.getMint()), e);
            return false;
        }
    }
}
