package com.virtualsol.discovery.modules.tokens.enrich;

import com.virtualsol.discovery.config.DiscoveryProperties;
import org.springframework.stereotype.Component;

/**
 * Feed ranking score in [0, 100].
 *
 * <p>{@code recency} falls linearly from 100 to 0 across the recency window, {@code liquidity}
 * reaches 100 at the liquidity target, {@code watcher} adds a fixed number of points per
 * watcher up to a cap. The three are blended by the configured weights and rounded.
 */
@Component
public class HotScoreCalculator {

    private static final double MAX_SCORE = 100.0;

    private final DiscoveryProperties.Scoring scoring;

    public HotScoreCalculator(DiscoveryProperties properties) {
        this.scoring = properties.getScoring();
    }

    public int score(double ageMinutes, double liquidityUsd, int watcherCount) {
        double recency = clamp(MAX_SCORE - (ageMinutes / scoring.getRecencyWindowMinutes()) * MAX_SCORE);
        double liquidity = clamp((liquidityUsd / scoring.getLiquidityScoreTargetUsd()) * MAX_SCORE);
        double watcher = Math.min(Math.max(0, watcherCount) * scoring.getWatcherScoreMultiplier(),
                scoring.getMaxWatcherScore());

        double blended = recency * scoring.getRecencyWeight()
                + liquidity * scoring.getLiquidityWeight()
                + clamp(watcher) * scoring.getWatcherWeight();
        return (int) Math.round(clamp(blended));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(MAX_SCORE, value));
    }
}
