package com.optionsbacktest.backtest.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Minimum tradability requirements for a candidate contract.
 */
@Value
@Builder
@Jacksonized
public class LiquidityCriteria {

    @Min(0)
    @Builder.Default
    long minVolume = 100;

    /** Maximum (ask - bid) / mid. */
    @DecimalMin("0.0")
    @Builder.Default
    double maxSpreadPct = 0.15;

    @Min(0)
    @Builder.Default
    long minOpenInterest = 0;

    /** Allows the single relaxed-liquidity retry when nothing is within delta tolerance. */
    @Builder.Default
    boolean allowRelaxation = true;
}
