package com.optionsbacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Aggregated return, risk and trade statistics for a run.
 * <p>
 * Returns and drawdown are fractions (0.05 = 5%). Every field is finite: a run
 * without trades or with a flat equity curve reports zeros.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceMetrics {

    private double initialCapital;
    private double finalValue;
    private double totalReturn;
    private double annualizedReturn;
    private double sharpeRatio;
    private double sortinoRatio;
    private double maxDrawdown;
    private int tradingDays;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private double winRate;
    private double averageWin;
    private double averageLoss;
    private double profitFactor;
    private double totalPnl;
    private double bestTrade;
    private double worstTrade;
    private double averageHoldingDays;
    private double totalCommissions;

    /** Closed trades per exit reason code. */
    private Map<String, Integer> exitReasonCounts;

    private ComplianceScorecard compliance;

    /** Entries that were only found after relaxing liquidity criteria. */
    private int relaxedSelections;
}
