package com.optionsbacktest.backtest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.optionsbacktest.backtest.dto.OptionRight;

/**
 * Which option rights a strategy is allowed to buy.
 */
public enum OptionTypeBias {
    CALL("call"),
    PUT("put"),
    EITHER("either");

    private final String code;

    OptionTypeBias(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static OptionTypeBias fromCode(String value) {
        for (OptionTypeBias bias : values()) {
            if (bias.code.equalsIgnoreCase(value)) {
                return bias;
            }
        }
        throw new IllegalArgumentException("Unknown option type: " + value + " (expected call, put or either)");
    }

    public boolean accepts(OptionRight right) {
        return this == EITHER
                || (this == CALL && right == OptionRight.CALL)
                || (this == PUT && right == OptionRight.PUT);
    }
}
