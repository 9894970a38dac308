package com.optionsbacktest.backtest.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Right of an option contract.
 */
public enum OptionRight {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionRight(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parses the common spellings found in option-chain exports ("C", "call", "PUT").
     */
    @JsonCreator
    public static OptionRight fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Option right is required");
        }
        String normalized = value.trim().toUpperCase();
        if ("C".equals(normalized) || "CALL".equals(normalized)) {
            return CALL;
        }
        if ("P".equals(normalized) || "PUT".equals(normalized)) {
            return PUT;
        }
        throw new IllegalArgumentException("Unknown option right: " + value);
    }
}
