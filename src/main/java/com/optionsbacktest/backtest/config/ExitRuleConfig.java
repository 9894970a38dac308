package com.optionsbacktest.backtest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of the {@code exit_rules} list.
 * <p>
 * Which parameters are required depends on {@link #condition}; the
 * {@link StrategyConfigValidator} enforces the combinations:
 * <ul>
 *   <li>{@code profit_target}, {@code stop_loss}: {@code threshold} as a fraction of entry cost</li>
 *   <li>{@code delta_stop}: {@code min_delta}, optionally {@code iv_adjusted}</li>
 *   <li>{@code indicator_exit}: {@code indicator} plus its level ({@code exit_level} or {@code exit_at_band_pct})</li>
 *   <li>{@code time_stop}: {@code max_days_held} and/or {@code dte_threshold}</li>
 * </ul>
 */
@Value
@Builder
@Jacksonized
public class ExitRuleConfig {

    @NotNull
    ExitCondition condition;

    @DecimalMin(value = "0.0", inclusive = false)
    Double threshold;

    @DecimalMin("0.0")
    Double minDelta;

    @Builder.Default
    boolean ivAdjusted = false;

    Indicator indicator;

    @Min(2)
    Integer period;

    /** RSI level: calls exit at or above it, puts at or below it. */
    Double exitLevel;

    /** Bollinger band position: calls exit at or above it, puts at or below it. */
    Double exitAtBandPct;

    @DecimalMin(value = "0.0", inclusive = false)
    Double stdDev;

    @Min(0)
    Integer maxDaysHeld;

    @Min(0)
    Integer dteThreshold;

    public enum Indicator {
        RSI("rsi"),
        BOLLINGER("bollinger");

        private final String code;

        Indicator(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static Indicator fromCode(String value) {
            for (Indicator indicator : values()) {
                if (indicator.code.equalsIgnoreCase(value)) {
                    return indicator;
                }
            }
            throw new IllegalArgumentException("Unknown indicator: " + value);
        }
    }
}
