package com.optionsbacktest.backtest.adapter;

import com.optionsbacktest.backtest.dto.MarketSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.optionsbacktest.backtest.SnapshotFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachingMarketSnapshotProviderTest {

    private static final LocalDate D1 = START;
    private static final LocalDate D2 = START.plusDays(1);
    private static final LocalDate D3 = START.plusDays(2);

    @Mock
    private MarketSnapshotProvider delegate;

    private CachingMarketSnapshotProvider cache;

    @BeforeEach
    void setUp() {
        cache = new CachingMarketSnapshotProvider(delegate, 2);
    }

    @Test
    @DisplayName("Should load once and serve repeats from cache")
    void hitsAndMisses() {
        MarketSnapshot snap = snapshot(D1, 100.0);
        when(delegate.snapshotFor(D1)).thenReturn(Optional.of(snap));

        assertSame(snap, cache.snapshotFor(D1).orElseThrow());
        assertSame(snap, cache.snapshotFor(D1).orElseThrow());

        verify(delegate, times(1)).snapshotFor(D1);
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
    }

    @Test
    @DisplayName("Missing dates are cached as well")
    void cachesEmpty() {
        when(delegate.snapshotFor(D2)).thenReturn(Optional.empty());

        assertTrue(cache.snapshotFor(D2).isEmpty());
        assertTrue(cache.snapshotFor(D2).isEmpty());

        verify(delegate, times(1)).snapshotFor(D2);
    }

    @Test
    @DisplayName("Should evict the least recently used date")
    void lruEviction() {
        when(delegate.snapshotFor(any())).thenReturn(Optional.empty());

        cache.snapshotFor(D1);
        cache.snapshotFor(D2);
        cache.snapshotFor(D1);
        cache.snapshotFor(D3);
        cache.snapshotFor(D1);
        cache.snapshotFor(D2);

        assertEquals(2, cache.size());
        verify(delegate, times(1)).snapshotFor(D1);
        verify(delegate, times(2)).snapshotFor(D2);
    }

    @Test
    @DisplayName("Calendar requests pass through")
    void calendarPassThrough() {
        when(delegate.tradingDays(D1, D3)).thenReturn(List.of(D1, D3));

        assertEquals(List.of(D1, D3), cache.tradingDays(D1, D3));
    }

    @Test
    @DisplayName("Rejects a non-positive capacity")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new CachingMarketSnapshotProvider(delegate, 0));
    }
}
