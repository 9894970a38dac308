package com.optionsbacktest.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of one simulation run: the trade ledger, the daily equity curve, the
 * computed metrics and the audit trail that explains every number in them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestResult {

    /**
     * Unique identifier for this run.
     */
    private String runId;

    private String strategyName;

    private String underlyingSymbol;

    private BacktestStatus status;

    /**
     * Error message if the run failed.
     */
    private String errorMessage;

    private LocalDate startDate;

    private LocalDate endDate;

    private double initialCapital;

    private double finalValue;

    /**
     * Closed trades in the order they were closed.
     */
    private List<ClosedTrade> trades;

    /**
     * One point per simulated trading day.
     */
    private List<EquityPoint> equityCurve;

    private PerformanceMetrics metrics;

    /**
     * Formatted audit lines, in simulation order.
     */
    private List<String> auditLog;

    private long executionDurationMs;

    public enum BacktestStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }
}
