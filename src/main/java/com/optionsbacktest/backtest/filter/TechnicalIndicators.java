package com.optionsbacktest.backtest.filter;

import lombok.experimental.UtilityClass;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Indicator math over daily series ordered oldest first.
 * Every function looks only at the tail of the series and returns empty when there
 * are not enough observations.
 * <p>
 * Moving average and Bollinger bands come from ta4j over a bar series of closes. RSI uses
 * simple averages of the last {@code period} changes, which ta4j's Wilder-smoothed
 * {@code RSIIndicator} does not compute, so it stays here.
 */
@UtilityClass
public class TechnicalIndicators {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    /**
     * Upper, middle and lower Bollinger bands.
     */
    public record Bands(double middle, double upper, double lower) {

        /** Position of {@code price} inside the bands: 0 at the lower band, 1 at the upper. */
        public double position(double price) {
            if (upper <= lower) {
                return 0.5;
            }
            return (price - lower) / (upper - lower);
        }
    }

    public static OptionalDouble sma(List<Double> series, int period) {
        if (period <= 0 || series.size() < period) {
            return OptionalDouble.empty();
        }
        BarSeries bars = tail(series, period);
        SMAIndicator sma = new SMAIndicator(new ClosePriceIndicator(bars), period);
        return OptionalDouble.of(sma.getValue(bars.getEndIndex()).doubleValue());
    }

    /**
     * RSI from simple averages of the last {@code period} price changes.
     * With no losses the RSI is 100 if there were gains and 50 on a flat series.
     */
    public static OptionalDouble rsi(List<Double> series, int period) {
        if (period <= 0 || series.size() < period + 1) {
            return OptionalDouble.empty();
        }
        double gains = 0;
        double losses = 0;
        for (int i = series.size() - period; i < series.size(); i++) {
            double change = series.get(i) - series.get(i - 1);
            if (change > 0) {
                gains += change;
            } else {
                losses -= change;
            }
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;
        if (avgLoss > 0) {
            double rs = avgGain / avgLoss;
            return OptionalDouble.of(100.0 - 100.0 / (1.0 + rs));
        }
        return OptionalDouble.of(avgGain > 0 ? 100.0 : 50.0);
    }

    /** Bands with population standard deviation. */
    public static Optional<Bands> bollinger(List<Double> series, int period, double stdDevs) {
        if (period <= 0 || series.size() < period) {
            return Optional.empty();
        }
        BarSeries bars = tail(series, period);
        ClosePriceIndicator close = new ClosePriceIndicator(bars);
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(close, period);
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(close, period));
        Num k = bars.numOf(stdDevs);
        BollingerBandsUpperIndicator upper = new BollingerBandsUpperIndicator(middle, deviation, k);
        BollingerBandsLowerIndicator lower = new BollingerBandsLowerIndicator(middle, deviation, k);

        int end = bars.getEndIndex();
        return Optional.of(new Bands(middle.getValue(end).doubleValue(),
                upper.getValue(end).doubleValue(), lower.getValue(end).doubleValue()));
    }

    /**
     * Mid-rank percentile of {@code value} among {@code population}, in [0, 100].
     * Ties count half, so a value equal to a flat population ranks at 50.
     */
    public static double percentileRank(List<Double> population, double value) {
        if (population.isEmpty()) {
            return 50.0;
        }
        double below = 0;
        double equal = 0;
        for (double v : population) {
            if (v < value) {
                below++;
            } else if (v == value) {
                equal++;
            }
        }
        return (below + 0.5 * equal) / population.size() * 100.0;
    }

    /** Exponentially weighted mean, seeded with the first observation. */
    public static OptionalDouble ewma(List<Double> series, double alpha) {
        if (series.isEmpty()) {
            return OptionalDouble.empty();
        }
        double value = series.get(0);
        for (int i = 1; i < series.size(); i++) {
            value = alpha * series.get(i) + (1 - alpha) * value;
        }
        return OptionalDouble.of(value);
    }

    /**
     * Annualized sample standard deviation of daily log returns over the last
     * {@code window} returns of the series.
     */
    public static OptionalDouble realizedVolatility(List<Double> series, int window) {
        if (window < 2 || series.size() < window + 1) {
            return OptionalDouble.empty();
        }
        List<Double> returns = new ArrayList<>(window);
        for (int i = series.size() - window; i < series.size(); i++) {
            double prev = series.get(i - 1);
            double curr = series.get(i);
            if (prev <= 0 || curr <= 0) {
                return OptionalDouble.empty();
            }
            returns.add(Math.log(curr / prev));
        }
        double mean = 0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.size();
        double ss = 0;
        for (double r : returns) {
            ss += (r - mean) * (r - mean);
        }
        return OptionalDouble.of(Math.sqrt(ss / (returns.size() - 1)) * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Realized volatility computed at each of the last {@code count} days of the series.
     * Days without a full window are skipped, so the result may be shorter than {@code count}.
     */
    public static List<Double> rollingRealizedVolatility(List<Double> series, int window, int count) {
        List<Double> out = new ArrayList<>(count);
        int start = Math.max(window + 1, series.size() - count + 1);
        for (int end = start; end <= series.size(); end++) {
            realizedVolatility(series.subList(0, end), window).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Daily bars holding the last {@code count} closes. Only the close is meaningful.
     */
    private static BarSeries tail(List<Double> closes, int count) {
        BarSeries bars = new BaseBarSeriesBuilder().withName("closes").build();
        ZonedDateTime end = ZonedDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        for (int i = closes.size() - count; i < closes.size(); i++) {
            double c = closes.get(i);
            end = end.plusDays(1);
            bars.addBar(end, c, c, c, c, 0);
        }
        return bars;
    }
}
