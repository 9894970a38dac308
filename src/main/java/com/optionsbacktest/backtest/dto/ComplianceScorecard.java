package com.optionsbacktest.backtest.dto;

/**
 * How closely executed entries matched the configured selection targets.
 * Rates are fractions in [0, 1].
 */
public record ComplianceScorecard(
        int totalTrades,
        int deltaCompliantTrades,
        int dteCompliantTrades,
        int fullyCompliantTrades,
        double deltaComplianceRate,
        double dteComplianceRate,
        double overallScore,
        double averageDeltaDeviation
) {
    public static ComplianceScorecard empty() {
        return new ComplianceScorecard(0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
