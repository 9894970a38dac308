package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.dto.ClosedTrade;
import com.optionsbacktest.backtest.dto.ComplianceScorecard;
import com.optionsbacktest.backtest.dto.EquityPoint;
import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import com.optionsbacktest.backtest.dto.PerformanceMetrics;
import com.optionsbacktest.backtest.exit.ExitReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceMetricsCalculator.
 */
class PerformanceMetricsCalculatorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 2);
    private static final double CAPITAL = 10_000.0;
    private static final double EPS = 1e-9;

    private PerformanceMetricsCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PerformanceMetricsCalculator(252);
    }

    private static List<EquityPoint> curve(double... totals) {
        List<EquityPoint> points = new ArrayList<>();
        for (int i = 0; i < totals.length; i++) {
            points.add(new EquityPoint(DAY.plusDays(i), totals[i], 0.0, totals[i], 0));
        }
        return points;
    }

    private static ClosedTrade trade(double pnl, ExitReason reason, int daysHeld, double entryDelta,
                                     boolean deltaCompliant, boolean dteCompliant, boolean relaxed) {
        return ClosedTrade.builder()
                .tradeId("P-" + reason.getCode())
                .realizedPnl(pnl)
                .exitReason(reason)
                .daysHeld(daysHeld)
                .commission(1.30)
                .entryGreeks(GreeksSnapshot.fresh(DAY, entryDelta, 0.05, -0.02, 0.1, 0.01, 0.2))
                .targetDelta(0.40)
                .deltaCompliant(deltaCompliant)
                .dteCompliant(dteCompliant)
                .relaxedSelection(relaxed)
                .build();
    }

    @Nested
    @DisplayName("Return and risk")
    class ReturnAndRiskTests {

        private final List<EquityPoint> curve = curve(10_000.0, 10_500.0, 9_450.0, 10_395.0);

        @Test
        @DisplayName("Should compute total and annualized return over the equity points")
        void returns() {
            PerformanceMetrics m = calculator.compute(List.of(), curve, CAPITAL);

            assertEquals(10_395.0, m.getFinalValue(), EPS);
            assertEquals(0.0395, m.getTotalReturn(), EPS);
            assertEquals(Math.pow(1.0395, 252.0 / 4) - 1.0, m.getAnnualizedReturn(), 1e-6);
            assertEquals(4, m.getTradingDays());
        }

        @Test
        @DisplayName("Should compute Sharpe and Sortino from population deviations")
        void ratios() {
            double mean = (0.05 - 0.10 + 0.10) / 3;
            double variance = (Math.pow(0.05 - mean, 2) + Math.pow(-0.10 - mean, 2) + Math.pow(0.10 - mean, 2)) / 3;
            double downside = Math.sqrt(0.01 / 3);

            PerformanceMetrics m = calculator.compute(List.of(), curve, CAPITAL);

            assertEquals(mean / Math.sqrt(variance) * Math.sqrt(252), m.getSharpeRatio(), 1e-6);
            assertEquals(mean / downside * Math.sqrt(252), m.getSortinoRatio(), 1e-6);
        }

        @Test
        @DisplayName("Max drawdown is measured from the running peak")
        void drawdown() {
            assertEquals(0.10, PerformanceMetricsCalculator.maxDrawdown(curve, CAPITAL), EPS);
        }

        @Test
        @DisplayName("Initial capital counts as the first peak")
        void drawdownFromInitialCapital() {
            assertEquals(0.05, PerformanceMetricsCalculator.maxDrawdown(curve(9_500.0, 9_800.0), CAPITAL), EPS);
        }

        @Test
        @DisplayName("Flat equity yields zero ratios instead of NaN")
        void flatCurve() {
            PerformanceMetrics m = calculator.compute(List.of(), curve(CAPITAL, CAPITAL, CAPITAL), CAPITAL);

            assertEquals(0.0, m.getSharpeRatio());
            assertEquals(0.0, m.getSortinoRatio());
            assertEquals(0.0, m.getMaxDrawdown());
            assertEquals(0.0, m.getAnnualizedReturn(), EPS);
        }

        @Test
        @DisplayName("Total loss annualizes to -100%")
        void totalLoss() {
            assertEquals(-1.0, calculator.annualize(-1.0, 10));
            assertEquals(0.0, calculator.annualize(0.5, 0));
        }

        @Test
        @DisplayName("A twentyfold gain in one day annualizes to a finite cap")
        void hugeShortGainStaysFinite() {
            PerformanceMetrics m = calculator.compute(List.of(), curve(200_000.0), CAPITAL);

            assertEquals(19.0, m.getTotalReturn(), EPS);
            assertTrue(Double.isFinite(m.getAnnualizedReturn()));
            assertEquals(Double.MAX_VALUE, m.getAnnualizedReturn());
        }

        @Test
        @DisplayName("Fewer than two returns gives zero ratios")
        void tooFewReturns() {
            assertEquals(0.0, calculator.sharpe(List.of(0.02)));
            assertEquals(0.0, calculator.sortino(List.of()));
        }
    }

    @Nested
    @DisplayName("Trade statistics")
    class TradeStatisticsTests {

        private final List<ClosedTrade> trades = List.of(
                trade(0.0, ExitReason.TIME_STOP, 10, 0.40, true, true, false),
                trade(300.0, ExitReason.PROFIT_TARGET, 3, 0.42, true, true, false),
                trade(-100.0, ExitReason.STOP_LOSS, 5, 0.48, false, true, true));

        @Test
        @DisplayName("Should aggregate wins, losses and holding time")
        void aggregates() {
            PerformanceMetrics m = calculator.compute(trades, curve(CAPITAL, 10_200.0), CAPITAL);

            assertEquals(3, m.getTotalTrades());
            assertEquals(1, m.getWinningTrades());
            assertEquals(2, m.getLosingTrades());
            assertEquals(1.0 / 3, m.getWinRate(), EPS);
            assertEquals(300.0, m.getAverageWin(), EPS);
            assertEquals(50.0, m.getAverageLoss(), EPS);
            assertEquals(3.0, m.getProfitFactor(), EPS);
            assertEquals(200.0, m.getTotalPnl(), EPS);
            assertEquals(300.0, m.getBestTrade(), EPS);
            assertEquals(-100.0, m.getWorstTrade(), EPS);
            assertEquals(6.0, m.getAverageHoldingDays(), EPS);
            assertEquals(3.90, m.getTotalCommissions(), EPS);
            assertEquals(1, m.getRelaxedSelections());
        }

        @Test
        @DisplayName("Exit reasons are counted by code in reason order")
        void exitReasonCounts() {
            PerformanceMetrics m = calculator.compute(trades, curve(CAPITAL), CAPITAL);

            assertEquals(List.of("profit_target", "stop_loss", "time_stop"),
                    new ArrayList<>(m.getExitReasonCounts().keySet()));
            assertEquals(1, m.getExitReasonCounts().get("stop_loss"));
        }

        @Test
        @DisplayName("Profit factor is capped when nothing lost")
        void profitFactorCap() {
            PerformanceMetrics m = calculator.compute(
                    List.of(trade(150.0, ExitReason.PROFIT_TARGET, 2, 0.40, true, true, false)), curve(CAPITAL), CAPITAL);

            assertEquals(PerformanceMetricsCalculator.PROFIT_FACTOR_CAP, m.getProfitFactor());
            assertEquals(150.0, m.getBestTrade());
            assertEquals(150.0, m.getWorstTrade());
        }

        @Test
        @DisplayName("Only losers gives a zero profit factor")
        void onlyLosers() {
            PerformanceMetrics m = calculator.compute(
                    List.of(trade(-50.0, ExitReason.STOP_LOSS, 2, 0.40, true, true, false)), curve(CAPITAL), CAPITAL);

            assertEquals(0.0, m.getProfitFactor());
            assertEquals(0.0, m.getWinRate());
        }

        @Test
        @DisplayName("A run without trades or equity reports finite zeros")
        void emptyRun() {
            PerformanceMetrics m = calculator.compute(List.of(), List.of(), CAPITAL);

            assertEquals(CAPITAL, m.getFinalValue());
            assertEquals(0.0, m.getTotalReturn());
            assertEquals(0.0, m.getAnnualizedReturn());
            assertEquals(0, m.getTotalTrades());
            assertEquals(0.0, m.getWinRate());
            assertEquals(0.0, m.getProfitFactor());
            assertEquals(0.0, m.getAverageHoldingDays());
            assertTrue(m.getExitReasonCounts().isEmpty());
            assertEquals(ComplianceScorecard.empty(), m.getCompliance());
        }
    }

    @Test
    @DisplayName("Compliance scorecard rates and delta deviation")
    void compliance() {
        ComplianceScorecard card = PerformanceMetricsCalculator.compliance(List.of(
                trade(0.0, ExitReason.TIME_STOP, 10, 0.40, true, true, false),
                trade(300.0, ExitReason.PROFIT_TARGET, 3, 0.42, true, true, false),
                trade(-100.0, ExitReason.STOP_LOSS, 5, -0.48, false, false, false)));

        assertEquals(3, card.totalTrades());
        assertEquals(2, card.deltaCompliantTrades());
        assertEquals(2, card.dteCompliantTrades());
        assertEquals(2, card.fullyCompliantTrades());
        assertEquals(2.0 / 3, card.deltaComplianceRate(), EPS);
        assertEquals(2.0 / 3, card.overallScore(), EPS);
        assertEquals((0.0 + 0.02 + 0.08) / 3, card.averageDeltaDeviation(), EPS);
    }
}
