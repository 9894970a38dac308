package com.optionsbacktest.backtest.adapter;

import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Snapshot provider over data already resident in memory.
 * <p>
 * Built either from snapshots or from flat option-chain rows (one row per contract per
 * date, as an external loader would produce them). Without an explicit calendar the trading
 * days are exactly the dates that have a snapshot; with one, calendar dates lacking a
 * snapshot surface as data gaps.
 * <p>
 * Immutable after construction and safe to share between concurrent runs.
 */
@Slf4j
public class InMemoryMarketSnapshotProvider implements MarketSnapshotProvider {

    private final NavigableMap<LocalDate, MarketSnapshot> snapshots;
    private final NavigableSet<LocalDate> calendar;

    public InMemoryMarketSnapshotProvider(Collection<MarketSnapshot> snapshots) {
        this(snapshots, null);
    }

    /**
     * @param snapshots available snapshots
     * @param calendar explicit trading calendar, or {@code null} to use the snapshot dates
     */
    public InMemoryMarketSnapshotProvider(Collection<MarketSnapshot> snapshots, Collection<LocalDate> calendar) {
        TreeMap<LocalDate, MarketSnapshot> byDate = new TreeMap<>();
        for (MarketSnapshot snapshot : snapshots) {
            if (byDate.put(snapshot.getDate(), snapshot) != null) {
                log.warn("Duplicate snapshot for {}, keeping the last one", snapshot.getDate());
            }
        }
        this.snapshots = Collections.unmodifiableNavigableMap(byDate);
        this.calendar = Collections.unmodifiableNavigableSet(
                new TreeSet<>(calendar != null ? calendar : byDate.keySet()));
        log.debug("In-memory provider ready: {} snapshots, {} calendar days", byDate.size(), this.calendar.size());
    }

    /**
     * Groups flat rows by date. The underlying price of a date is taken from its first row.
     */
    public static InMemoryMarketSnapshotProvider fromQuotes(List<OptionQuote> rows) {
        return fromQuotes(rows, null);
    }

    public static InMemoryMarketSnapshotProvider fromQuotes(List<OptionQuote> rows, Collection<LocalDate> calendar) {
        Map<LocalDate, List<OptionQuote>> grouped = new LinkedHashMap<>();
        for (OptionQuote row : rows) {
            grouped.computeIfAbsent(row.getDate(), d -> new ArrayList<>()).add(row);
        }
        List<MarketSnapshot> snapshots = new ArrayList<>(grouped.size());
        for (Map.Entry<LocalDate, List<OptionQuote>> entry : grouped.entrySet()) {
            double underlying = entry.getValue().get(0).getUnderlyingPrice();
            snapshots.add(new MarketSnapshot(entry.getKey(), underlying, entry.getValue()));
        }
        return new InMemoryMarketSnapshotProvider(snapshots, calendar);
    }

    @Override
    public List<LocalDate> tradingDays(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            return List.of();
        }
        return List.copyOf(calendar.subSet(from, true, to, true));
    }

    @Override
    public Optional<MarketSnapshot> snapshotFor(LocalDate date) {
        return Optional.ofNullable(snapshots.get(date));
    }
}
