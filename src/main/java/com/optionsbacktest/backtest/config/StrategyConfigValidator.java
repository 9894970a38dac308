package com.optionsbacktest.backtest.config;

import com.optionsbacktest.backtest.config.MarketFilterConfig.FilterName;
import com.optionsbacktest.backtest.config.MarketFilterConfig.OrGroup;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link StrategyConfig} before any simulation starts.
 * <p>
 * Field-level constraints come from Bean Validation annotations on the config classes;
 * this class adds the cross-field rules that annotations cannot express. All violations
 * are collected and reported together in one {@link ConfigValidationException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StrategyConfigValidator {

    private final Validator validator;

    /**
     * @throws ConfigValidationException listing every violation found
     */
    public void validate(StrategyConfig config) {
        if (config == null) {
            throw new ConfigValidationException(List.of("configuration is required"));
        }

        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<StrategyConfig> violation : validator.validate(config)) {
            violations.add(toSnakeCase(violation.getPropertyPath().toString()) + " " + violation.getMessage());
        }
        // Cross-field rules assume the structure is present
        if (violations.isEmpty()) {
            checkSelection(config.getOptionSelection(), violations);
            checkExitRules(config.getExitRules(), violations);
            if (config.getMarketFilters() != null) {
                checkMarketFilters(config.getMarketFilters(), violations);
            }
        }

        if (!violations.isEmpty()) {
            violations.sort(String::compareTo);
            log.error("Strategy '{}' failed validation: {}", config.getName(), violations);
            throw new ConfigValidationException(violations);
        }
        log.debug("Strategy '{}' passed validation", config.getName());
    }

    // ==================== SELECTION ====================

    private void checkSelection(OptionSelectionConfig selection, List<String> violations) {
        DteCriteria dte = selection.getDte();
        if (dte.getMin() > dte.getMax()) {
            violations.add("option_selection.dte: min (" + dte.getMin() + ") is greater than max (" + dte.getMax() + ")");
        } else if (!dte.contains(dte.getTarget())) {
            violations.add("option_selection.dte: target (" + dte.getTarget() + ") is outside [" + dte.getMin() + ", " + dte.getMax() + "]");
        }

        DeltaCriteria delta = selection.getDelta();
        if (delta.getMin() != null && delta.getMax() != null && delta.getMin() > delta.getMax()) {
            violations.add("option_selection.delta: min (" + delta.getMin() + ") is greater than max (" + delta.getMax() + ")");
        }
        if (delta.getMin() != null && delta.getTarget() < delta.getMin()) {
            violations.add("option_selection.delta: target (" + delta.getTarget() + ") is below min (" + delta.getMin() + ")");
        }
        if (delta.getMax() != null && delta.getTarget() > delta.getMax()) {
            violations.add("option_selection.delta: target (" + delta.getTarget() + ") is above max (" + delta.getMax() + ")");
        }
    }

    // ==================== EXIT RULES ====================

    private void checkExitRules(List<ExitRuleConfig> rules, List<String> violations) {
        Set<ExitCondition> seen = EnumSet.noneOf(ExitCondition.class);
        for (int i = 0; i < rules.size(); i++) {
            ExitRuleConfig rule = rules.get(i);
            String path = "exit_rules[" + i + "] (" + rule.getCondition().getCode() + ")";

            if (rule.getCondition() != ExitCondition.INDICATOR_EXIT && !seen.add(rule.getCondition())) {
                violations.add(path + ": duplicate exit condition");
            }

            switch (rule.getCondition()) {
                case PROFIT_TARGET -> {
                    if (rule.getThreshold() == null) {
                        violations.add(path + ": threshold is required");
                    }
                }
                case STOP_LOSS -> {
                    if (rule.getThreshold() == null) {
                        violations.add(path + ": threshold is required");
                    } else if (rule.getThreshold() > 1.0) {
                        violations.add(path + ": threshold must not exceed 1.0 (a loss of the full entry cost)");
                    }
                }
                case DELTA_STOP -> {
                    if (rule.getMinDelta() == null) {
                        violations.add(path + ": min_delta is required");
                    }
                }
                case INDICATOR_EXIT -> {
                    if (rule.getIndicator() == null) {
                        violations.add(path + ": indicator is required (rsi or bollinger)");
                    }
                }
                case TIME_STOP -> {
                    if (rule.getMaxDaysHeld() == null && rule.getDteThreshold() == null) {
                        violations.add(path + ": max_days_held or dte_threshold is required");
                    }
                }
            }
        }
    }

    // ==================== MARKET FILTERS ====================

    private void checkMarketFilters(MarketFilterConfig filters, List<String> violations) {
        if (filters.getVolatilityRegime() != null) {
            MarketFilterConfig.VolatilityRegimeFilter vol = filters.getVolatilityRegime();
            if (vol.getLowPercentile() >= vol.getHighPercentile()) {
                violations.add("market_filters.volatility_regime: low_percentile must be below high_percentile");
            }
            if (vol.getMinIv() != null && vol.getMaxIv() != null && vol.getMinIv() > vol.getMaxIv()) {
                violations.add("market_filters.volatility_regime: min_iv is greater than max_iv");
            }
        }
        if (filters.getRsi() != null && filters.getRsi().getOversold() >= filters.getRsi().getOverbought()) {
            violations.add("market_filters.rsi: oversold must be below overbought");
        }
        if (filters.getBollinger() != null
                && filters.getBollinger().getLowerBandThreshold() >= filters.getBollinger().getUpperBandThreshold()) {
            violations.add("market_filters.bollinger: lower_band_threshold must be below upper_band_threshold");
        }

        Set<String> groupNames = new HashSet<>();
        Map<FilterName, String> membership = new EnumMap<>(FilterName.class);
        for (OrGroup group : filters.getOrGroups()) {
            if (!groupNames.add(group.getName())) {
                violations.add("market_filters.or_groups: duplicate group name '" + group.getName() + "'");
            }
            for (FilterName member : group.getMembers()) {
                if (!filters.isConfigured(member)) {
                    violations.add("market_filters.or_groups." + group.getName() + ": member '"
                            + member.getCode() + "' is not configured");
                }
                String previous = membership.put(member, group.getName());
                if (previous != null && !previous.equals(group.getName())) {
                    violations.add("market_filters.or_groups: '" + member.getCode()
                            + "' belongs to both '" + previous + "' and '" + group.getName() + "'");
                }
            }
        }
    }

    private static String toSnakeCase(String propertyPath) {
        return propertyPath.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }
}
