package com.optionsbacktest.backtest.filter;

import com.optionsbacktest.backtest.config.MarketFilterConfig;
import com.optionsbacktest.backtest.config.MarketFilterConfig.BollingerFilter;
import com.optionsbacktest.backtest.config.MarketFilterConfig.FilterName;
import com.optionsbacktest.backtest.config.MarketFilterConfig.OrGroup;
import com.optionsbacktest.backtest.config.MarketFilterConfig.RsiFilter;
import com.optionsbacktest.backtest.config.MarketFilterConfig.TrendFilter;
import com.optionsbacktest.backtest.config.MarketFilterConfig.VolatilityRegime;
import com.optionsbacktest.backtest.config.MarketFilterConfig.VolatilityRegimeFilter;
import com.optionsbacktest.backtest.config.MarketFilterConfig.VolatilitySource;
import com.optionsbacktest.backtest.config.OptionTypeBias;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Market Condition Filter
 *
 * Decides whether a new position may be opened today. Evaluates up to four independently
 * configured rules against the underlying's history up to and including today:
 * 1. Trend: price relative to its moving average
 * 2. Volatility regime: today's implied or realized volatility bucketed low/normal/high
 * 3. RSI: oversold for calls, overbought for puts
 * 4. Bollinger: price near the lower band for calls, the upper band for puts
 *
 * Rules combine with AND; rules listed in an OR group combine with OR and the group counts
 * as one AND term. A rule without enough history passes and says so. Never throws for data
 * reasons.
 *
 * Thread-safety: stateless; all inputs arrive as method parameters.
 */
@Slf4j
public class MarketConditionFilter {

    static final String INSUFFICIENT_HISTORY = "insufficient history";

    /**
     * Result of a single rule.
     */
    record RuleOutcome(FilterName filter, boolean passed, String rationale) {
    }

    /**
     * Main entry point.
     *
     * @param date    the simulated day
     * @param history observations up to and including {@code date}
     * @param config  filter configuration, may be {@code null}
     * @param bias    option type the strategy trades, which decides the direction of RSI and band rules
     */
    public MarketFilterResult allowEntry(LocalDate date, MarketHistory history,
                                         MarketFilterConfig config, OptionTypeBias bias) {
        if (config == null || config.isEmpty()) {
            return MarketFilterResult.unfiltered("no market filters configured");
        }
        if (history.isEmpty() || !date.equals(history.lastDate())) {
            // The engine appends today before asking; anything else means no price for today
            return MarketFilterResult.unfiltered("no underlying price for " + date + ", filters skipped");
        }

        Map<FilterName, RuleOutcome> outcomes = new EnumMap<>(FilterName.class);
        if (config.getTrend() != null) {
            outcomes.put(FilterName.TREND, checkTrend(history, config.getTrend()));
        }
        if (config.getVolatilityRegime() != null) {
            outcomes.put(FilterName.VOLATILITY_REGIME, checkVolatilityRegime(history, config.getVolatilityRegime()));
        }
        if (config.getRsi() != null) {
            outcomes.put(FilterName.RSI, checkRsi(history, config.getRsi(), bias));
        }
        if (config.getBollinger() != null) {
            outcomes.put(FilterName.BOLLINGER, checkBollinger(history, config.getBollinger(), bias));
        }

        return combine(date, outcomes, config.getOrGroups());
    }

    // ==================== COMBINATION ====================

    private MarketFilterResult combine(LocalDate date, Map<FilterName, RuleOutcome> outcomes, List<OrGroup> groups) {
        List<String> passedRules = new ArrayList<>();
        List<String> failedRules = new ArrayList<>();
        List<String> blockingTerms = new ArrayList<>();

        Set<FilterName> grouped = EnumSet.noneOf(FilterName.class);
        for (OrGroup group : groups) {
            boolean anyPassed = false;
            for (FilterName member : group.getMembers()) {
                grouped.add(member);
                RuleOutcome outcome = outcomes.get(member);
                if (outcome != null && outcome.passed()) {
                    anyPassed = true;
                }
            }
            if (!anyPassed) {
                blockingTerms.add("group '" + group.getName() + "'");
            }
        }
        for (RuleOutcome outcome : outcomes.values()) {
            if (outcome.passed()) {
                passedRules.add(outcome.rationale());
            } else {
                failedRules.add(outcome.rationale());
                if (!grouped.contains(outcome.filter())) {
                    blockingTerms.add(outcome.filter().getCode());
                }
            }
        }

        if (blockingTerms.isEmpty()) {
            String reason = "market filters passed: " + String.join("; ", passedRules);
            log.debug("{} entry allowed - {}", date, reason);
            return MarketFilterResult.allowed(reason, passedRules, failedRules);
        }
        String reason = "blocked by " + String.join(", ", blockingTerms) + ": " + String.join("; ", failedRules);
        log.debug("{} entry blocked - {}", date, reason);
        return MarketFilterResult.blocked(reason, passedRules, failedRules);
    }

    // ==================== RULES ====================

    RuleOutcome checkTrend(MarketHistory history, TrendFilter cfg) {
        OptionalDouble ma = TechnicalIndicators.sma(history.closes(), cfg.getMaPeriod());
        if (ma.isEmpty()) {
            return insufficient(FilterName.TREND, history.size(), cfg.getMaPeriod());
        }
        double price = history.lastClose();
        double maValue = ma.getAsDouble();
        boolean passed = cfg.isRequireAboveMa() ? price >= maValue : price <= maValue;
        String relation = price >= maValue ? ">=" : "<";
        return new RuleOutcome(FilterName.TREND, passed, String.format(Locale.ROOT, "trend: price %.2f %s MA(%d) %.2f (require %s)",
                price, relation, cfg.getMaPeriod(), maValue, cfg.isRequireAboveMa() ? "above" : "below"));
    }

    RuleOutcome checkVolatilityRegime(MarketHistory history, VolatilityRegimeFilter cfg) {
        int needed = cfg.getLookbackDays() + 1;
        List<Double> series = volatilitySeries(history, cfg, needed);
        if (series.size() < needed) {
            return insufficient(FilterName.VOLATILITY_REGIME, series.size(), needed);
        }
        double today = series.get(series.size() - 1);
        List<Double> prior = series.subList(series.size() - needed, series.size() - 1);

        VolatilityRegime regime;
        String measure;
        switch (cfg.getMethod()) {
            case EWMA -> {
                double mean = TechnicalIndicators.ewma(prior, cfg.getEwmaAlpha()).getAsDouble();
                if (today < mean * (1 - cfg.getEwmaBand())) {
                    regime = VolatilityRegime.LOW;
                } else if (today > mean * (1 + cfg.getEwmaBand())) {
                    regime = VolatilityRegime.HIGH;
                } else {
                    regime = VolatilityRegime.NORMAL;
                }
                measure = String.format(Locale.ROOT, "EWMA %.4f", mean);
            }
            default -> {
                double rank = TechnicalIndicators.percentileRank(prior, today);
                if (rank < cfg.getLowPercentile()) {
                    regime = VolatilityRegime.LOW;
                } else if (rank > cfg.getHighPercentile()) {
                    regime = VolatilityRegime.HIGH;
                } else {
                    regime = VolatilityRegime.NORMAL;
                }
                measure = String.format(Locale.ROOT, "percentile %.1f", rank);
            }
        }

        boolean passed = cfg.getAllowedRegimes().contains(regime);
        String bounds = "";
        if (cfg.getMinIv() != null && today < cfg.getMinIv()) {
            passed = false;
            bounds = String.format(Locale.ROOT, ", below min %.4f", cfg.getMinIv());
        } else if (cfg.getMaxIv() != null && today > cfg.getMaxIv()) {
            passed = false;
            bounds = String.format(Locale.ROOT, ", above max %.4f", cfg.getMaxIv());
        }
        return new RuleOutcome(FilterName.VOLATILITY_REGIME, passed,
                String.format(Locale.ROOT, "volatility_regime: %s vol %.4f (%s) is %s%s", cfg.getSource().getCode(),
                        today, measure, regime.getCode(), bounds));
    }

    RuleOutcome checkRsi(MarketHistory history, RsiFilter cfg, OptionTypeBias bias) {
        OptionalDouble rsi = TechnicalIndicators.rsi(history.closes(), cfg.getPeriod());
        if (rsi.isEmpty()) {
            return insufficient(FilterName.RSI, history.size(), cfg.getPeriod() + 1);
        }
        double value = rsi.getAsDouble();
        boolean oversold = value <= cfg.getOversold();
        boolean overbought = value >= cfg.getOverbought();
        boolean passed = switch (bias) {
            case CALL -> oversold;
            case PUT -> overbought;
            case EITHER -> oversold || overbought;
        };
        String state = oversold ? "oversold" : overbought ? "overbought" : "neutral";
        return new RuleOutcome(FilterName.RSI, passed, String.format(Locale.ROOT, "rsi: RSI(%d) %.1f is %s for %s bias",
                cfg.getPeriod(), value, state, bias.getCode()));
    }

    RuleOutcome checkBollinger(MarketHistory history, BollingerFilter cfg, OptionTypeBias bias) {
        Optional<TechnicalIndicators.Bands> bands =
                TechnicalIndicators.bollinger(history.closes(), cfg.getPeriod(), cfg.getStdDev());
        if (bands.isEmpty()) {
            return insufficient(FilterName.BOLLINGER, history.size(), cfg.getPeriod());
        }
        double position = bands.get().position(history.lastClose());
        boolean nearLower = position <= cfg.getLowerBandThreshold();
        boolean nearUpper = position >= cfg.getUpperBandThreshold();
        boolean passed = switch (bias) {
            case CALL -> nearLower;
            case PUT -> nearUpper;
            case EITHER -> nearLower || nearUpper;
        };
        return new RuleOutcome(FilterName.BOLLINGER, passed,
                String.format(Locale.ROOT, "bollinger: band position %.2f (lower %.2f, upper %.2f, thresholds %.2f/%.2f)",
                        position, bands.get().lower(), bands.get().upper(),
                        cfg.getLowerBandThreshold(), cfg.getUpperBandThreshold()));
    }

    // ==================== HELPERS ====================

    private static List<Double> volatilitySeries(MarketHistory history, VolatilityRegimeFilter cfg, int needed) {
        if (cfg.getSource() == VolatilitySource.REALIZED) {
            return TechnicalIndicators.rollingRealizedVolatility(history.closes(), cfg.getRealizedWindow(), needed);
        }
        List<Double> all = history.atmImpliedVols();
        if (all.isEmpty() || Double.isNaN(all.get(all.size() - 1))) {
            // No ATM quote today: today's value is unknown, so the rule cannot judge it
            return List.of();
        }
        List<Double> observed = new ArrayList<>(needed);
        for (int i = all.size() - 1; i >= 0 && observed.size() < needed; i--) {
            double v = all.get(i);
            if (!Double.isNaN(v)) {
                observed.add(0, v);
            }
        }
        return observed;
    }

    private static RuleOutcome insufficient(FilterName filter, int have, int need) {
        return new RuleOutcome(filter, true,
                filter.getCode() + ": " + INSUFFICIENT_HISTORY + " (" + have + " of " + need + " observations)");
    }
}
