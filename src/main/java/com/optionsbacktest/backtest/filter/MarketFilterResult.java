package com.optionsbacktest.backtest.filter;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of the entry gate for one day with the rationale of every sub-filter.
 */
public record MarketFilterResult(
        boolean allowed,
        String reason,
        List<String> passedRules,
        List<String> failedRules
) {
    public static MarketFilterResult allowed(String reason, List<String> passedRules, List<String> failedRules) {
        return new MarketFilterResult(true, reason, List.copyOf(passedRules), List.copyOf(failedRules));
    }

    public static MarketFilterResult blocked(String reason, List<String> passedRules, List<String> failedRules) {
        return new MarketFilterResult(false, reason, List.copyOf(passedRules), List.copyOf(failedRules));
    }

    public static MarketFilterResult unfiltered(String reason) {
        return new MarketFilterResult(true, reason, Collections.emptyList(), Collections.emptyList());
    }
}
