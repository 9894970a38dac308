package com.optionsbacktest.backtest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Entry criteria for choosing a contract from the day's chain.
 */
@Value
@Builder
@Jacksonized
public class OptionSelectionConfig {

    @NotNull
    @Builder.Default
    OptionTypeBias type = OptionTypeBias.CALL;

    @NotNull
    @Valid
    DeltaCriteria delta;

    @NotNull
    @Valid
    DteCriteria dte;

    @NotNull
    @Valid
    @Builder.Default
    LiquidityCriteria liquidity = LiquidityCriteria.builder().build();
}
