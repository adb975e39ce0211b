package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.providers.HolderCountProvider;
import com.virtualsol.discovery.modules.tokens.buffer.BufferedTokenData;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stages fresh holder counts for live tokens that have traded at least once.
 */
@Slf4j
@Component
public class HolderCountJob implements ScheduledJob {

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenBufferManager bufferManager;
    private final HolderCountProvider holderCountProvider;
    private final int batchSize;
    private final Duration interval;

    public HolderCountJob(TokenDiscoveryRepository tokenRepository,
                          TokenBufferManager bufferManager,
                          HolderCountProvider holderCountProvider,
                          DiscoveryProperties properties) {
        this.tokenRepository = tokenRepository;
        this.bufferManager = bufferManager;
        this.holderCountProvider = holderCountProvider;
        this.batchSize = properties.getLimits().getMaxHolderCountBatch();
        this.interval = properties.getIntervals().getHolderCountUpdate();
    }

    @Override
    public String getName() {
        return "holder-count";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        List<TokenDiscovery> batch = tokenRepository.findByStateNotOrderByLastUpdatedAtAsc(
                TokenState.DEAD, PageRequest.of(0, batchSize));

        int staged = 0;
        for (TokenDiscovery token : batch) {
            if (token.getLastTradeTs() == null) {
                continue;
            }
            String mint = token.getMint();
            try {
                Optional<Integer> holders = holderCountProvider.getHolderCount(mint);
                if (holders.isEmpty() || Objects.equals(holders.get(), token.getHolderCount())) {
                    continue;
                }
                bufferManager.bufferToken(BufferedTokenData.builder()
                        .mint(mint)
                        .holderCount(holders.get())
                        .build());
                staged++;
            } catch (RuntimeException e) {
                log.warn("Holder count lookup failed for {}: {}", MintValidator.abbreviate(mint), e.getMessage());
            }
        }
        log.debug("Holder counts: staged {} of {} tokens", staged, batch.size());
    }
}
