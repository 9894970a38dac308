package com.optionsbacktest.backtest.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    private static final double EPS = 1e-9;

    @Nested
    @DisplayName("Moving average and RSI")
    class AverageTests {

        @Test
        @DisplayName("SMA averages the last period values and needs a full window")
        void sma() {
            assertEquals(3.0, TechnicalIndicators.sma(List.of(1.0, 2.0, 3.0, 4.0), 3).getAsDouble(), EPS);
            assertTrue(TechnicalIndicators.sma(List.of(1.0, 2.0), 3).isEmpty());
        }

        @Test
        @DisplayName("RSI is 100 on gains only, 50 on a flat series and balanced moves")
        void rsiEdges() {
            assertEquals(100.0, TechnicalIndicators.rsi(List.of(1.0, 2.0, 3.0), 2).getAsDouble(), EPS);
            assertEquals(50.0, TechnicalIndicators.rsi(List.of(5.0, 5.0, 5.0), 2).getAsDouble(), EPS);
            assertEquals(50.0, TechnicalIndicators.rsi(List.of(10.0, 11.0, 10.0), 2).getAsDouble(), EPS);
            assertEquals(0.0, TechnicalIndicators.rsi(List.of(3.0, 2.0, 1.0), 2).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("RSI needs period + 1 observations")
        void rsiNeedsHistory() {
            assertTrue(TechnicalIndicators.rsi(List.of(1.0, 2.0), 2).isEmpty());
        }
    }

    @Nested
    @DisplayName("Bands and ranks")
    class BandTests {

        @Test
        @DisplayName("Bollinger bands use population standard deviation")
        void bollinger() {
            TechnicalIndicators.Bands bands = TechnicalIndicators.bollinger(List.of(1.0, 3.0), 2, 2.0).orElseThrow();

            assertEquals(2.0, bands.middle(), EPS);
            assertEquals(4.0, bands.upper(), EPS);
            assertEquals(0.0, bands.lower(), EPS);
            assertEquals(0.75, bands.position(3.0), EPS);
        }

        @Test
        @DisplayName("Bands and average ignore closes before the window")
        void windowOnly() {
            TechnicalIndicators.Bands bands = TechnicalIndicators.bollinger(
                    List.of(1000.0, -50.0, 2.0, 4.0, 6.0), 3, 1.0).orElseThrow();
            double std = Math.sqrt(8.0 / 3);

            assertEquals(4.0, bands.middle(), EPS);
            assertEquals(4.0 + std, bands.upper(), 1e-9);
            assertEquals(4.0 - std, bands.lower(), 1e-9);
            assertEquals(4.0, TechnicalIndicators.sma(List.of(1000.0, -50.0, 2.0, 4.0, 6.0), 3).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("Flat series puts price in the middle of collapsed bands")
        void collapsedBands() {
            TechnicalIndicators.Bands bands = TechnicalIndicators.bollinger(List.of(5.0, 5.0, 5.0), 3, 2.0).orElseThrow();
            assertEquals(0.5, bands.position(5.0), EPS);
        }

        @Test
        @DisplayName("Percentile rank counts ties as half")
        void percentileRank() {
            assertEquals(62.5, TechnicalIndicators.percentileRank(List.of(1.0, 2.0, 3.0, 4.0), 3.0), EPS);
            assertEquals(50.0, TechnicalIndicators.percentileRank(List.of(5.0, 5.0, 5.0), 5.0), EPS);
            assertEquals(100.0, TechnicalIndicators.percentileRank(List.of(1.0, 2.0), 9.0), EPS);
        }

        @Test
        @DisplayName("EWMA is seeded with the first observation")
        void ewma() {
            assertEquals(1.5, TechnicalIndicators.ewma(List.of(1.0, 2.0), 0.5).getAsDouble(), EPS);
            assertTrue(TechnicalIndicators.ewma(List.of(), 0.5).isEmpty());
        }
    }

    @Nested
    @DisplayName("Realized volatility")
    class RealizedVolatilityTests {

        @Test
        @DisplayName("Annualized sample standard deviation of log returns")
        void realizedVolatility() {
            double r1 = Math.log(110.0 / 100.0);
            double r2 = Math.log(99.0 / 110.0);
            double mean = (r1 + r2) / 2;
            double expected = Math.sqrt(((r1 - mean) * (r1 - mean) + (r2 - mean) * (r2 - mean)) / 1) * Math.sqrt(252);

            assertEquals(expected, TechnicalIndicators.realizedVolatility(List.of(100.0, 110.0, 99.0), 2).getAsDouble(), 1e-12);
        }

        @Test
        @DisplayName("Constant growth has zero volatility; short series have none")
        void edges() {
            assertEquals(0.0, TechnicalIndicators.realizedVolatility(List.of(100.0, 110.0, 121.0), 2).getAsDouble(), 1e-9);
            assertTrue(TechnicalIndicators.realizedVolatility(List.of(100.0, 110.0), 2).isEmpty());
        }

        @Test
        @DisplayName("Rolling series skips days without a full window")
        void rolling() {
            List<Double> closes = List.of(100.0, 101.0, 99.0, 102.0, 100.0);
            List<Double> rolling = TechnicalIndicators.rollingRealizedVolatility(closes, 2, 10);

            assertEquals(3, rolling.size());
            assertEquals(TechnicalIndicators.realizedVolatility(closes, 2).getAsDouble(), rolling.get(2), EPS);
        }
    }
}
