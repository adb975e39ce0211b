package com.virtualsol.discovery.modules.jobs;

import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.buffer.TokenBufferManager;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import com.virtualsol.discovery.modules.tokens.state.TokenStateManager;
import com.virtualsol.discovery.repository.TokenDiscoveryRepository;
import com.virtualsol.discovery.util.MintValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-classifies the least recently updated live tokens, one batch per tick.
 *
 * <p>Classification reads the stored row with staged fields applied. Unchanged tokens are
 * touched so the next tick moves on to the following batch.
 */
@Slf4j
@Component
public class StateClassificationJob implements ScheduledJob {

    private final TokenDiscoveryRepository tokenRepository;
    private final TokenBufferManager bufferManager;
    private final TokenStateManager stateManager;
    private final int batchSize;
    private final Duration interval;
    private final Clock clock;

    public StateClassificationJob(TokenDiscoveryRepository tokenRepository,
                                  TokenBufferManager bufferManager,
                                  TokenStateManager stateManager,
                                  DiscoveryProperties properties,
                                  Clock clock) {
        this.tokenRepository = tokenRepository;
        this.bufferManager = bufferManager;
        this.stateManager = stateManager;
        this.batchSize = properties.getLimits().getMaxTokensPerBatch();
        this.interval = properties.getIntervals().getStateClassification();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "state-classification";
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    @Override
    public void run() {
        List<TokenDiscovery> batch = tokenRepository.findByStateNotOrderByLastUpdatedAtAsc(
                TokenState.DEAD, PageRequest.of(0, batchSize));

        int transitions = 0;
        List<String> unchanged = new ArrayList<>();
        for (TokenDiscovery token : batch) {
            try {
                if (reclassify(token)) {
                    transitions++;
                } else {
                    unchanged.add(token.getMint());
                }
            } catch (RuntimeException e) {
                log.error("Failed to classify {}", MintValidator.abbreviate(token.getMint()), e);
            }
        }
        if (!unchanged.isEmpty()) {
            tokenRepository.touch(unchanged, clock.instant());
        }
        log.info("State classification: {} transitions in batch of {}", transitions, batch.size());
    }

    private boolean reclassify(TokenDiscovery token) {
        bufferManager.getBuffered(token.getMint()).ifPresent(staged -> staged.applyTo(token));
        return stateManager.reclassify(token);
    }
}
