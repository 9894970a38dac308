package com.optionsbacktest.backtest.filter;

import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rolling record of the underlying's daily observations, appended by the engine one
 * simulated day at a time.
 * <p>
 * Because the engine appends a day only after reading that day's snapshot, a consumer can
 * never see an observation later than the day being simulated. Days without a snapshot
 * are not appended.
 */
public class MarketHistory {

    /** ATM means strike within this fraction of spot. */
    static final double ATM_BAND = 0.02;
    static final int PROXY_MIN_DTE = 25;
    static final int PROXY_MAX_DTE = 35;

    private final List<LocalDate> dates = new ArrayList<>();
    private final List<Double> closes = new ArrayList<>();
    private final List<Double> atmImpliedVols = new ArrayList<>();

    /**
     * Records the day's underlying close and ATM implied-volatility proxy.
     *
     * @throws IllegalStateException if the date does not advance
     */
    public void append(MarketSnapshot snapshot) {
        LocalDate date = snapshot.getDate();
        if (!dates.isEmpty() && !date.isAfter(dates.get(dates.size() - 1))) {
            throw new IllegalStateException("History must advance: " + date + " after " + dates.get(dates.size() - 1));
        }
        dates.add(date);
        closes.add(snapshot.getUnderlyingPrice());
        atmImpliedVols.add(atmImpliedVolatility(snapshot));
    }

    public int size() {
        return closes.size();
    }

    public boolean isEmpty() {
        return closes.isEmpty();
    }

    public LocalDate lastDate() {
        return dates.isEmpty() ? null : dates.get(dates.size() - 1);
    }

    public double lastClose() {
        return closes.get(closes.size() - 1);
    }

    /** Underlying closes, oldest first, ending with the current day. */
    public List<Double> closes() {
        return Collections.unmodifiableList(closes);
    }

    /** ATM IV proxy per day, {@code NaN} where the chain had no usable ATM contract. */
    public List<Double> atmImpliedVols() {
        return Collections.unmodifiableList(atmImpliedVols);
    }

    /**
     * Mean implied volatility of contracts within {@link #ATM_BAND} of spot, preferring the
     * 25-35 DTE window and falling back to any expiry.
     *
     * @return the proxy, or {@code NaN} if no contract qualifies
     */
    static double atmImpliedVolatility(MarketSnapshot snapshot) {
        double spot = snapshot.getUnderlyingPrice();
        if (spot <= 0) {
            return Double.NaN;
        }
        double windowSum = 0;
        int windowCount = 0;
        double anySum = 0;
        int anyCount = 0;
        for (OptionQuote quote : snapshot.getQuotes()) {
            if (quote.getImpliedVolatility() <= 0 || Math.abs(quote.getStrike() - spot) / spot > ATM_BAND) {
                continue;
            }
            anySum += quote.getImpliedVolatility();
            anyCount++;
            long dte = quote.daysToExpiration(snapshot.getDate());
            if (dte >= PROXY_MIN_DTE && dte <= PROXY_MAX_DTE) {
                windowSum += quote.getImpliedVolatility();
                windowCount++;
            }
        }
        if (windowCount > 0) {
            return windowSum / windowCount;
        }
        return anyCount > 0 ? anySum / anyCount : Double.NaN;
    }
}
