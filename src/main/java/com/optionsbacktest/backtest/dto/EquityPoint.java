package com.optionsbacktest.backtest.dto;

import java.time.LocalDate;

/**
 * End-of-day portfolio valuation.
 *
 * @param positionValue sum of open-position market values at the day's marks
 * @param totalValue    cash plus position value
 */
public record EquityPoint(
        LocalDate date,
        double cash,
        double positionValue,
        double totalValue,
        int openPositions
) {
}
