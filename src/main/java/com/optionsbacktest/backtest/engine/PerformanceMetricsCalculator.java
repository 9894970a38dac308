package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.dto.ClosedTrade;
import com.optionsbacktest.backtest.dto.ComplianceScorecard;
import com.optionsbacktest.backtest.dto.EquityPoint;
import com.optionsbacktest.backtest.dto.PerformanceMetrics;
import com.optionsbacktest.backtest.exit.ExitReason;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes run statistics from the trade ledger and the equity curve.
 * <p>
 * Pure function of its inputs. Ratios with a zero denominator are reported as 0, and the
 * profit factor of a run without losing trades is capped, so every field is finite.
 */
@Slf4j
public class PerformanceMetricsCalculator {

    /** Reported profit factor when there are winners but no losers. */
    public static final double PROFIT_FACTOR_CAP = 999.99;

    private final int tradingDaysPerYear;

    public PerformanceMetricsCalculator(int tradingDaysPerYear) {
        this.tradingDaysPerYear = tradingDaysPerYear;
    }

    public PerformanceMetrics compute(List<ClosedTrade> trades, List<EquityPoint> equityCurve, double initialCapital) {
        double finalValue = equityCurve.isEmpty() ? initialCapital : equityCurve.get(equityCurve.size() - 1).totalValue();
        double totalReturn = initialCapital > 0 ? (finalValue - initialCapital) / initialCapital : 0.0;

        List<Double> returns = dailyReturns(equityCurve);

        PerformanceMetrics.PerformanceMetricsBuilder builder = PerformanceMetrics.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue)
                .totalReturn(totalReturn)
                .annualizedReturn(annualize(totalReturn, equityCurve.size()))
                .sharpeRatio(sharpe(returns))
                .sortinoRatio(sortino(returns))
                .maxDrawdown(maxDrawdown(equityCurve, initialCapital))
                .tradingDays(equityCurve.size());

        applyTradeStats(builder, trades);
        builder.compliance(compliance(trades));

        PerformanceMetrics metrics = builder.build();
        log.debug("Metrics: return={}, sharpe={}, maxDD={}, trades={}, winRate={}",
                metrics.getTotalReturn(), metrics.getSharpeRatio(), metrics.getMaxDrawdown(),
                metrics.getTotalTrades(), metrics.getWinRate());
        return metrics;
    }

    // ==================== RETURN & RISK ====================

    static List<Double> dailyReturns(List<EquityPoint> curve) {
        List<Double> returns = new ArrayList<>(Math.max(0, curve.size() - 1));
        for (int i = 1; i < curve.size(); i++) {
            double prev = curve.get(i - 1).totalValue();
            if (prev > 0) {
                returns.add(curve.get(i).totalValue() / prev - 1.0);
            }
        }
        return returns;
    }

    /**
     * Compounds the total return to a trading year. Short, large gains overflow the power,
     * so the result is capped at {@link Double#MAX_VALUE} to keep metrics finite.
     */
    double annualize(double totalReturn, int days) {
        if (days <= 0) {
            return 0.0;
        }
        if (totalReturn <= -1.0) {
            return -1.0;
        }
        double annualized = Math.pow(1.0 + totalReturn, (double) tradingDaysPerYear / days) - 1.0;
        return Double.isFinite(annualized) ? annualized : Double.MAX_VALUE;
    }

    double sharpe(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double variance = 0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double std = Math.sqrt(variance / returns.size());
        return std > 0 ? mean / std * Math.sqrt(tradingDaysPerYear) : 0.0;
    }

    double sortino(List<Double> returns) {
        if (returns.size() < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double downside = 0;
        for (double r : returns) {
            double d = Math.min(r, 0.0);
            downside += d * d;
        }
        double downsideDeviation = Math.sqrt(downside / returns.size());
        return downsideDeviation > 0 ? mean / downsideDeviation * Math.sqrt(tradingDaysPerYear) : 0.0;
    }

    /** Largest peak-to-trough decline as a fraction of the peak; the initial capital is the first peak. */
    static double maxDrawdown(List<EquityPoint> curve, double initialCapital) {
        double peak = initialCapital;
        double maxDrawdown = 0;
        for (EquityPoint point : curve) {
            peak = Math.max(peak, point.totalValue());
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - point.totalValue()) / peak);
            }
        }
        return maxDrawdown;
    }

    // ==================== TRADES ====================

    private void applyTradeStats(PerformanceMetrics.PerformanceMetricsBuilder builder, List<ClosedTrade> trades) {
        int wins = 0;
        int losses = 0;
        double grossProfit = 0;
        double grossLoss = 0;
        double totalPnl = 0;
        double best = 0;
        double worst = 0;
        double holdingDays = 0;
        double commissions = 0;
        int relaxed = 0;
        Map<ExitReason, Integer> reasons = new LinkedHashMap<>();

        for (int i = 0; i < trades.size(); i++) {
            ClosedTrade t = trades.get(i);
            double pnl = t.getRealizedPnl();
            totalPnl += pnl;
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
            } else {
                losses++;
                grossLoss += Math.abs(pnl);
            }
            best = i == 0 ? pnl : Math.max(best, pnl);
            worst = i == 0 ? pnl : Math.min(worst, pnl);
            holdingDays += t.getDaysHeld();
            commissions += t.getCommission();
            if (t.isRelaxedSelection()) {
                relaxed++;
            }
            reasons.merge(t.getExitReason(), 1, Integer::sum);
        }

        int total = trades.size();
        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossProfit / grossLoss;
        } else {
            profitFactor = grossProfit > 0 ? PROFIT_FACTOR_CAP : 0.0;
        }

        Map<String, Integer> reasonCounts = new LinkedHashMap<>();
        for (ExitReason reason : ExitReason.values()) {
            Integer count = reasons.get(reason);
            if (count != null) {
                reasonCounts.put(reason.getCode(), count);
            }
        }

        builder.totalTrades(total)
                .winningTrades(wins)
                .losingTrades(losses)
                .winRate(total > 0 ? (double) wins / total : 0.0)
                .averageWin(wins > 0 ? grossProfit / wins : 0.0)
                .averageLoss(losses > 0 ? grossLoss / losses : 0.0)
                .profitFactor(profitFactor)
                .totalPnl(totalPnl)
                .bestTrade(best)
                .worstTrade(worst)
                .averageHoldingDays(total > 0 ? holdingDays / total : 0.0)
                .totalCommissions(commissions)
                .exitReasonCounts(reasonCounts)
                .relaxedSelections(relaxed);
    }

    static ComplianceScorecard compliance(List<ClosedTrade> trades) {
        if (trades.isEmpty()) {
            return ComplianceScorecard.empty();
        }
        int deltaOk = 0;
        int dteOk = 0;
        int both = 0;
        double deviation = 0;
        for (ClosedTrade t : trades) {
            if (t.isDeltaCompliant()) {
                deltaOk++;
            }
            if (t.isDteCompliant()) {
                dteOk++;
            }
            if (t.isDeltaCompliant() && t.isDteCompliant()) {
                both++;
            }
            deviation += Math.abs(Math.abs(t.getEntryGreeks().delta()) - t.getTargetDelta());
        }
        int n = trades.size();
        double deltaRate = (double) deltaOk / n;
        double dteRate = (double) dteOk / n;
        return new ComplianceScorecard(n, deltaOk, dteOk, both, deltaRate, dteRate,
                (deltaRate + dteRate) / 2.0, deviation / n);
    }

    private static double mean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
