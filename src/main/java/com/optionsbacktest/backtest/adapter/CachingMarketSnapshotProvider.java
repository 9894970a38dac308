package com.optionsbacktest.backtest.adapter;

import com.optionsbacktest.backtest.dto.MarketSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache in front of another provider.
 * <p>
 * Owned by whoever creates it and passed into the engine explicitly; there is no
 * process-wide cache. Missing dates are cached too so a slow source is asked once.
 */
@Slf4j
public class CachingMarketSnapshotProvider implements MarketSnapshotProvider {

    private final MarketSnapshotProvider delegate;
    private final int maxEntries;
    private final Map<LocalDate, Optional<MarketSnapshot>> cache;

    private long hits;
    private long misses;

    public CachingMarketSnapshotProvider(MarketSnapshotProvider delegate, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.delegate = delegate;
        this.maxEntries = maxEntries;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<LocalDate, Optional<MarketSnapshot>> eldest) {
                return size() > CachingMarketSnapshotProvider.this.maxEntries;
            }
        };
    }

    @Override
    public List<LocalDate> tradingDays(LocalDate from, LocalDate to) {
        return delegate.tradingDays(from, to);
    }

    @Override
    public synchronized Optional<MarketSnapshot> snapshotFor(LocalDate date) {
        Optional<MarketSnapshot> cached = cache.get(date);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        Optional<MarketSnapshot> loaded = delegate.snapshotFor(date);
        cache.put(date, loaded);
        return loaded;
    }

    public synchronized int size() {
        return cache.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }
}
