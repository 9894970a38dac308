package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.adapter.MarketSnapshotProvider;
import com.optionsbacktest.backtest.dto.ContractKey;
import com.optionsbacktest.backtest.dto.EquityPoint;
import com.optionsbacktest.backtest.filter.MarketHistory;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one backtest run, owned by a single {@link BacktestEngine}.
 * <p>
 * Positions live in an arena keyed by id. The open and closed sets hold ids only, and a
 * position moves from open to closed exclusively through {@link #close(String, double)}.
 * The engine iterates over {@link #openIdsSnapshot()} and applies closures afterwards, so
 * the set being iterated is never modified.
 */
@Getter
public class BacktestContext {

    private final String runId;
    private final MarketSnapshotProvider provider;
    private final double initialCapital;

    // ==================== CASH & POSITIONS ====================

    private double cash;

    @Getter(AccessLevel.NONE)
    private final Map<String, Position> positions = new LinkedHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> openIds = new LinkedHashSet<>();
    @Getter(AccessLevel.NONE)
    private final List<String> closedIds = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private int positionSequence;

    // ==================== DAY STATE ====================

    @Setter
    private LocalDate currentDate;

    @Setter
    private int dayIndex = -1;

    /** Day index of the most recent entry, -1 before the first. */
    @Setter
    private int lastEntryDayIndex = -1;

    private final MarketHistory history = new MarketHistory();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    public BacktestContext(String runId, MarketSnapshotProvider provider, double initialCapital) {
        this.runId = runId;
        this.provider = provider;
        this.initialCapital = initialCapital;
        this.cash = initialCapital;
    }

    public String nextPositionId() {
        positionSequence++;
        return String.format(Locale.ROOT, "P-%04d", positionSequence);
    }

    /**
     * Adds a freshly filled position and pays its entry cost.
     */
    public void open(Position position) {
        if (positions.putIfAbsent(position.getId(), position) != null) {
            throw new IllegalStateException("Duplicate position id " + position.getId());
        }
        openIds.add(position.getId());
        cash -= position.getEntryCost();
    }

    /**
     * Moves a position to the closed set and credits its exit proceeds.
     */
    public void close(String positionId, double exitValue) {
        if (!openIds.remove(positionId)) {
            throw new IllegalStateException("Position " + positionId + " is not open");
        }
        positions.get(positionId).close();
        closedIds.add(positionId);
        cash += exitValue;
    }

    public Position position(String id) {
        return positions.get(id);
    }

    /** Stable copy of the open ids, in opening order. */
    public List<String> openIdsSnapshot() {
        return List.copyOf(openIds);
    }

    public List<Position> openPositions() {
        List<Position> open = new ArrayList<>(openIds.size());
        for (String id : openIds) {
            open.add(positions.get(id));
        }
        return open;
    }

    public int openCount() {
        return openIds.size();
    }

    public List<ContractKey> heldContracts() {
        List<ContractKey> keys = new ArrayList<>(openIds.size());
        for (String id : openIds) {
            keys.add(positions.get(id).getContract());
        }
        return keys;
    }

    public double openPositionValue() {
        double value = 0;
        for (String id : openIds) {
            value += positions.get(id).getMarketValue();
        }
        return value;
    }

    public EquityPoint appendEquityPoint(LocalDate date) {
        double positionValue = openPositionValue();
        EquityPoint point = new EquityPoint(date, cash, positionValue, cash + positionValue, openIds.size());
        equityCurve.add(point);
        return point;
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public List<String> getClosedIds() {
        return Collections.unmodifiableList(closedIds);
    }

    public int totalPositionsOpened() {
        return positions.size();
    }
}
