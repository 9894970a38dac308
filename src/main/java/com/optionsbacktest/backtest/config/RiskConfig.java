package com.optionsbacktest.backtest.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Capital, sizing and position-count limits.
 */
@Value
@Builder
@Jacksonized
public class RiskConfig {

    @DecimalMin(value = "0.0", inclusive = false)
    double initialCapital;

    /** Fraction of current cash committed to each new position. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    double positionSizeFraction;

    @Min(1)
    @Builder.Default
    int maxConcurrentPositions = 1;

    /** Charged per contract on entry only. */
    @DecimalMin("0.0")
    @Builder.Default
    double commissionPerContract = 0.65;

    @Min(1)
    @Builder.Default
    int maxContractsPerTrade = 100;

    /** Trading days that must pass after an entry before the next one; 0 allows daily entries. */
    @Min(0)
    @Builder.Default
    int minDaysBetweenEntries = 0;
}
