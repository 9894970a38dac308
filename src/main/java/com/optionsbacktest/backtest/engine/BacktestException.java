package com.optionsbacktest.backtest.engine;

/**
 * Exception for backtest-specific errors.
 * Carries a structured error code so callers can tell configuration problems from
 * unusable inputs.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        CONFIG_VALIDATION,
        CONFIG_LOAD_FAILED,
        INVALID_DATE_RANGE,
        NO_MARKET_DATA,
        SIMULATION_ERROR,
        BACKTEST_DISABLED
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
