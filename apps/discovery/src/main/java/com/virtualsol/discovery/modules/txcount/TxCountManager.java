package com.virtualsol.discovery.modules.txcount;

import com.virtualsol.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local count of distinct transaction signatures per mint, plus the SOL traded in the
 * trailing {@code maxAge} window.
 *
 * <p>Approximation rebuilt from live traffic; never persisted. Bounded by {@code maxSize}
 * tracked mints and {@code maxAge} since the last touch.
 */
@Slf4j
@Component
public class TxCountManager {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final int maxSize;
    private final Duration maxAge;
    private final Clock clock;

    @Autowired
    public TxCountManager(DiscoveryProperties properties, Clock clock) {
        this(properties.getLimits().getTxCountMaxSize(), properties.getLimits().getTxCountMaxAge(), clock);
    }

    public TxCountManager(int maxSize, Duration maxAge, Clock clock) {
        this.maxSize = maxSize;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public void addTransaction(String mint, String txId) {
        addTransaction(mint, txId, null);
    }

    /**
     * Records a trade. A signature seen before is not counted again, and neither is its volume.
     */
    public void addTransaction(String mint, String txId, BigDecimal solAmount) {
        Entry entry = entries.computeIfAbsent(mint, k -> new Entry());
        long now = clock.millis();
        synchronized (entry) {
            if (entry.txIds.add(txId) && solAmount != null && solAmount.signum() != 0) {
                entry.trades.addLast(new Trade(now, solAmount.abs()));
            }
            entry.lastUpdated = now;
        }
        if (entries.size() > maxSize) {
            cleanup();
        }
    }

    public int getCount(String mint) {
        Entry entry = entries.get(mint);
        if (entry == null) {
            return 0;
        }
        synchronized (entry) {
            return entry.txIds.size();
        }
    }

    /**
     * SOL traded in the trailing window, or zero if nothing was recorded.
     */
    public BigDecimal getVolumeSol(String mint) {
        Entry entry = entries.get(mint);
        if (entry == null) {
            return BigDecimal.ZERO;
        }
        long cutoff = clock.millis() - maxAge.toMillis();
        synchronized (entry) {
            while (!entry.trades.isEmpty() && entry.trades.peekFirst().at < cutoff) {
                entry.trades.removeFirst();
            }
            BigDecimal total = BigDecimal.ZERO;
            for (Trade trade : entry.trades) {
                total = total.add(trade.solAmount);
            }
            return total;
        }
    }

    /**
     * Purges entries older than the max age, then evicts least recently updated
     * entries until the map is under the size cap.
     */
    public synchronized void cleanup() {
        long cutoff = clock.millis() - maxAge.toMillis();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().lastUpdated < cutoff);

        int excess = entries.size() - maxSize;
        if (excess > 0) {
            List<String> oldest = entries.entrySet().stream()
                    .sorted(Comparator.comparingLong(e -> e.getValue().lastUpdated))
                    .limit(excess)
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            oldest.forEach(entries::remove);
        }

        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("TxCount cleanup removed {} entries, {} remaining", removed, entries.size());
        }
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final Set<String> txIds = new HashSet<>();
        private final Deque<Trade> trades = new ArrayDeque<>();
        private volatile long lastUpdated;
    }

    private static final class Trade {
        private final long at;
        private final BigDecimal solAmount;

        private Trade(long at, BigDecimal solAmount) {
            this.at = at;
            this.solAmount = solAmount;
        }
    }
}
