package com.virtualsol.discovery.repository;

import com.virtualsol.discovery.entity.TokenDiscovery;
import com.virtualsol.discovery.modules.tokens.state.TokenState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface TokenDiscoveryRepository extends JpaRepository<TokenDiscovery, String> {

    List<TokenDiscovery> findByStateNotOrderByLastUpdatedAtAsc(TokenState state, Pageable pageable);

    List<TokenDiscovery> findByStateIn(Collection<TokenState> states, Pageable pageable);

    @Query("""
            select t.mint from TokenDiscovery t
            where t.volume24h > :minVolume
               or t.marketCapUsd > :minMarketCap
               or t.lastTradeTs >= :tradedSince
               or t.state = :aboutToBond
            order by t.volume24h desc nulls last, t.marketCapUsd desc nulls last
            """)
    List<String> findActiveMints(@Param("minVolume") BigDecimal minVolume,
                                 @Param("minMarketCap") BigDecimal minMarketCap,
                                 @Param("tradedSince") Instant tradedSince,
                                 @Param("aboutToBond") TokenState aboutToBond,
                                 Pageable pageable);

    /**
     * Tokens worth a market refresh: bonded within the window, about to bond, or launched
     * within the window. Least recently updated first.
     */
    @Query("""
            select t from TokenDiscovery t
            where (t.state = :bonded and t.stateChangedAt >= :since)
               or t.state = :aboutToBond
               or (t.state in :fresh and t.firstSeenAt >= :since)
            order by t.lastUpdatedAt asc
            """)
    List<TokenDiscovery> findMarketRefreshCandidates(@Param("bonded") TokenState bonded,
                                                     @Param("aboutToBond") TokenState aboutToBond,
                                                     @Param("fresh") Collection<TokenState> fresh,
                                                     @Param("since") Instant since,
                                                     Pageable pageable);

    @Query("""
            select t.mint from TokenDiscovery t
            where (t.state = :dead and t.lastUpdatedAt < :deadBefore)
               or (t.state = :launching and t.lastTradeTs is null and t.firstSeenAt < :launchedBefore)
            """)
    List<String> findExpiredMints(@Param("dead") TokenState dead,
                                  @Param("deadBefore") Instant deadBefore,
                                  @Param("launching") TokenState launching,
                                  @Param("launchedBefore") Instant launchedBefore);

    @Modifying
    @Transactional
    @Query("delete from TokenDiscovery t where t.mint in :mints")
    int deleteByMintIn(@Param("mints") Collection<String> mints);

    @Modifying
    @Transactional
    @Query("""
            update TokenDiscovery t
            set t.state = :newState, t.previousState = :oldState,
                t.stateChangedAt = :changedAt, t.lastUpdatedAt = :changedAt
            where t.mint = :mint
            """)
    int updateState(@Param("mint") String mint,
                    @Param("newState") TokenState newState,
                    @Param("oldState") TokenState oldState,
                    @Param("changedAt") Instant changedAt);

    @Modifying
    @Transactional
    @Query("update TokenDiscovery t set t.lastUpdatedAt = :now where t.mint in :mints")
    int touch(@Param("mints") Collection<String> mints, @Param("now") Instant now);
}
