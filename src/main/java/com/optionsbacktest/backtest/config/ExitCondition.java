package com.optionsbacktest.backtest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Exit rule kinds that can appear in a strategy's {@code exit_rules} list.
 */
public enum ExitCondition {
    PROFIT_TARGET("profit_target"),
    STOP_LOSS("stop_loss"),
    DELTA_STOP("delta_stop"),
    INDICATOR_EXIT("indicator_exit"),
    TIME_STOP("time_stop");

    private final String code;

    ExitCondition(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ExitCondition fromCode(String value) {
        for (ExitCondition condition : values()) {
            if (condition.code.equalsIgnoreCase(value)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("Unknown exit condition: " + value);
    }
}
