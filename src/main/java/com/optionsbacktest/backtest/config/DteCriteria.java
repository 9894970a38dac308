package com.optionsbacktest.backtest.config;

import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Days-to-expiration window, in calendar days from the entry date.
 */
@Value
@Builder
@Jacksonized
public class DteCriteria {

    @Min(0)
    int target;

    @Min(0)
    int min;

    @Min(0)
    int max;

    public boolean contains(long dte) {
        return dte >= min && dte <= max;
    }
}
