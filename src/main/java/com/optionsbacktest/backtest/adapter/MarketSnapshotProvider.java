package com.optionsbacktest.backtest.adapter;

import com.optionsbacktest.backtest.dto.MarketSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Source of daily option-chain snapshots for one underlying.
 *
 * This interface abstracts the data source allowing easy swapping between:
 * - Rows already loaded from files or a database (see {@link InMemoryMarketSnapshotProvider})
 * - A bounded cache over a slower source (see {@link CachingMarketSnapshotProvider})
 * - Mock data (unit testing)
 *
 * Implementations are pure lookups: the same date always yields the same snapshot.
 */
public interface MarketSnapshotProvider {

    /**
     * Trading calendar for the range.
     * <p>
     * A day may be listed here and still have no snapshot; the engine treats such a day
     * as a data gap.
     *
     * @param from first date (inclusive)
     * @param to last date (inclusive)
     * @return trading dates sorted ascending, without duplicates
     */
    List<LocalDate> tradingDays(LocalDate from, LocalDate to);

    /**
     * @param date trading date
     * @return the day's snapshot, or empty when the source has no data for that date
     */
    Optional<MarketSnapshot> snapshotFor(LocalDate date);
}
