package com.optionsbacktest.backtest.config;

import com.optionsbacktest.backtest.engine.BacktestException;

import java.util.List;

/**
 * A strategy configuration is malformed or internally inconsistent.
 * Raised before the first simulated day; never recovered from.
 */
public class ConfigValidationException extends BacktestException {

    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super(ErrorCode.CONFIG_VALIDATION, "Invalid strategy configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigValidationException(String violation, Throwable cause) {
        super(ErrorCode.CONFIG_VALIDATION, "Invalid strategy configuration: " + violation, cause);
        this.violations = List.of(violation);
    }

    public List<String> getViolations() {
        return violations;
    }
}
