package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.dto.ContractKey;
import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A long option position held by the engine.
 * <p>
 * Entry fields are fixed at construction. Only the engine's collaborators in this package
 * mutate the rest: {@link PositionTracker} moves the mark and appends Greeks, and
 * {@link BacktestContext} closes it. The entry date is the simulated day the engine opened
 * the position on, not the date stamped on the quote. The Greeks history holds exactly one entry per
 * simulated day the position has been open, entry day included.
 */
@Getter
public class Position {

    public enum Status {
        OPEN,
        CLOSED
    }

    private final String id;
    private final String underlyingSymbol;
    private final ContractKey contract;
    private final LocalDate entryDate;
    private final double entryPrice;
    private final int contracts;
    private final double commission;

    /** Fill x contracts x 100 + commission; never changes after open. */
    private final double entryCost;

    private final double entryUnderlyingPrice;
    private final OptionQuote entryQuote;
    private final GreeksSnapshot entryGreeks;

    private final double targetDelta;
    private final boolean deltaCompliant;
    private final boolean dteCompliant;
    private final boolean relaxedSelection;

    private final List<GreeksSnapshot> greeksHistory = new ArrayList<>();

    private double currentMark;
    private LocalDate lastMarkDate;
    private boolean markStale;
    private int daysHeld;
    private Status status = Status.OPEN;

    Position(String id, String underlyingSymbol, LocalDate entryDate, OptionQuote entryQuote, int contracts,
             double fillPrice, double commissionPerContract, double targetDelta, boolean deltaCompliant, boolean dteCompliant,
             boolean relaxedSelection) {
        if (contracts <= 0) {
            throw new IllegalArgumentException("Position " + id + " needs a positive contract count: " + contracts);
        }
        this.id = id;
        this.underlyingSymbol = underlyingSymbol;
        this.contract = entryQuote.key();
        this.entryDate = entryDate;
        this.entryPrice = fillPrice;
        this.contracts = contracts;
        this.commission = commissionPerContract * contracts;
        this.entryCost = fillPrice * contracts * 100.0 + this.commission;
        this.entryUnderlyingPrice = entryQuote.getUnderlyingPrice();
        this.entryQuote = entryQuote;
        GreeksSnapshot quoted = entryQuote.greeks();
        this.entryGreeks = GreeksSnapshot.fresh(entryDate, quoted.delta(), quoted.gamma(), quoted.theta(),
                quoted.vega(), quoted.rho(), quoted.impliedVolatility());
        this.targetDelta = targetDelta;
        this.deltaCompliant = deltaCompliant;
        this.dteCompliant = dteCompliant;
        this.relaxedSelection = relaxedSelection;

        this.currentMark = fillPrice;
        this.lastMarkDate = entryDate;
        this.greeksHistory.add(entryGreeks);
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }

    /** Market value at the current mark. */
    public double getMarketValue() {
        return currentMark * contracts * 100.0;
    }

    public double getUnrealizedPnl() {
        return getMarketValue() - entryCost;
    }

    public List<GreeksSnapshot> getGreeksHistory() {
        return Collections.unmodifiableList(greeksHistory);
    }

    public GreeksSnapshot latestGreeks() {
        return greeksHistory.get(greeksHistory.size() - 1);
    }

    // ==================== ENGINE MUTATIONS ====================

    void advanceDay() {
        requireOpen();
        daysHeld++;
    }

    void markFresh(LocalDate date, double mark, GreeksSnapshot greeks) {
        requireOpen();
        this.currentMark = mark;
        this.lastMarkDate = date;
        this.markStale = false;
        this.greeksHistory.add(greeks);
    }

    void markStale(LocalDate date) {
        requireOpen();
        this.markStale = true;
        this.greeksHistory.add(latestGreeks().carriedTo(date));
    }

    void close() {
        requireOpen();
        this.status = Status.CLOSED;
    }

    private void requireOpen() {
        if (status != Status.OPEN) {
            throw new IllegalStateException("Position " + id + " is already closed");
        }
    }
}
