package com.optionsbacktest.backtest.dto;

import java.time.LocalDate;

/**
 * Greeks of a held contract on one simulated day.
 * <p>
 * A stale snapshot repeats the last observed values on a day the contract had no quote.
 */
public record GreeksSnapshot(
        LocalDate date,
        double delta,
        double gamma,
        double theta,
        double vega,
        double rho,
        double impliedVolatility,
        boolean stale
) {
    public static GreeksSnapshot fresh(LocalDate date, double delta, double gamma, double theta,
                                       double vega, double rho, double impliedVolatility) {
        return new GreeksSnapshot(date, delta, gamma, theta, vega, rho, impliedVolatility, false);
    }

    public GreeksSnapshot carriedTo(LocalDate newDate) {
        return new GreeksSnapshot(newDate, delta, gamma, theta, vega, rho, impliedVolatility, true);
    }
}
