package com.optionsbacktest.backtest.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Delta selection criteria. All values are absolute deltas, so a put with
 * delta -0.30 matches a target of 0.30.
 */
@Value
@Builder
@Jacksonized
public class DeltaCriteria {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    double target;

    /**
     * Maximum accepted distance from the target. When absent the closest candidate is
     * taken regardless of distance and liquidity is never relaxed.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double tolerance;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double min;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double max;

    public boolean hasTolerance() {
        return tolerance != null;
    }
}
