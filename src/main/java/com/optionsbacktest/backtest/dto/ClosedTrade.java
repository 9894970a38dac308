package com.optionsbacktest.backtest.dto;

import com.optionsbacktest.backtest.exit.ExitReason;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable record of one position from fill to close.
 * <p>
 * {@code realizedPnl} is always {@code exitPrice * contracts * 100 - entryCost}, and
 * {@code pnlPct} is {@code realizedPnl / entryCost}.
 */
@Value
@Builder
public class ClosedTrade {

    String tradeId;
    String underlyingSymbol;
    ContractKey contract;

    // ==================== ENTRY ====================

    LocalDate entryDate;
    double entryPrice;
    int contracts;
    double entryCost;
    double commission;
    double entryUnderlyingPrice;
    double entryBid;
    double entryAsk;
    double entrySpreadPct;
    long entryVolume;
    long entryOpenInterest;
    long entryDte;
    GreeksSnapshot entryGreeks;

    // ==================== EXIT ====================

    LocalDate exitDate;
    double exitPrice;
    double exitUnderlyingPrice;
    GreeksSnapshot exitGreeks;
    ExitReason exitReason;
    String exitDetail;

    // ==================== RESULT ====================

    double realizedPnl;
    double pnlPct;
    int daysHeld;
    long calendarDaysHeld;
    List<GreeksSnapshot> greeksHistory;

    // ==================== SELECTION COMPLIANCE ====================

    double targetDelta;
    boolean deltaCompliant;
    boolean dteCompliant;
    boolean relaxedSelection;

    public boolean isWin() {
        return realizedPnl > 0;
    }

    public double exitValue() {
        return exitPrice * contracts * 100.0;
    }
}
