package com.optionsbacktest.backtest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Validated, immutable description of one strategy run.
 * <p>
 * Built once by {@link StrategyConfigLoader} (or directly through the builder in code) and
 * checked by {@link StrategyConfigValidator} before the first simulated day.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StrategyConfig {

    @NotBlank
    String name;

    @NotBlank
    @Builder.Default
    String underlying = "SPY";

    @NotNull
    @Valid
    OptionSelectionConfig optionSelection;

    /** Evaluated in fixed priority order regardless of list order. */
    @NotNull
    @Builder.Default
    List<@Valid @NotNull ExitRuleConfig> exitRules = List.of();

    @NotNull
    @Valid
    RiskConfig risk;

    @Valid
    MarketFilterConfig marketFilters;

    public boolean hasMarketFilters() {
        return marketFilters != null && !marketFilters.isEmpty();
    }
}
