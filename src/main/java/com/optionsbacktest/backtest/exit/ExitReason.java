package com.optionsbacktest.backtest.exit;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a position was closed. Recorded on every closed trade.
 */
public enum ExitReason {
    PROFIT_TARGET("profit_target"),
    STOP_LOSS("stop_loss"),
    DELTA_STOP("delta_stop"),
    INDICATOR_EXIT("indicator_exit"),
    TIME_STOP("time_stop"),
    /** Contract reached its expiration date while held. */
    EXPIRATION("expiration"),
    /** Still open after the last simulated day. */
    END_OF_PERIOD("end_of_period");

    private final String code;

    ExitReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
