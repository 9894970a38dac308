package com.optionsbacktest.backtest.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One option-chain row for one contract on one trading date.
 */
@Value
@Builder(toBuilder = true)
public class OptionQuote {

    LocalDate date;
    double underlyingPrice;
    double strike;
    LocalDate expiration;
    OptionRight right;
    double bid;
    double ask;
    double close;
    long volume;
    long openInterest;
    double delta;
    double gamma;
    double theta;
    double vega;
    double rho;
    double impliedVolatility;

    public ContractKey key() {
        return new ContractKey(strike, expiration, right);
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }

    /**
     * Bid-ask spread as a fraction of the mid price, or {@code Double.POSITIVE_INFINITY}
     * when the mid is not positive.
     */
    public double spreadPct() {
        double mid = mid();
        if (mid <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return (ask - bid) / mid;
    }

    /** Calendar days from {@code asOf} to expiration. */
    public long daysToExpiration(LocalDate asOf) {
        return ChronoUnit.DAYS.between(asOf, expiration);
    }

    /** Crossed market or negative prices. */
    public boolean isAnomalous() {
        return bid > ask || bid < 0 || ask < 0 || close < 0 || strike <= 0;
    }

    public GreeksSnapshot greeks() {
        return GreeksSnapshot.fresh(date, delta, gamma, theta, vega, rho, impliedVolatility);
    }
}
