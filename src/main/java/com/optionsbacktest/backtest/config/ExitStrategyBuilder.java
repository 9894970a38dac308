package com.optionsbacktest.backtest.config;

import com.optionsbacktest.backtest.exit.DeltaStopExitStrategy;
import com.optionsbacktest.backtest.exit.ExitStrategy;
import com.optionsbacktest.backtest.exit.ExpirationExitStrategy;
import com.optionsbacktest.backtest.exit.IndicatorExitStrategy;
import com.optionsbacktest.backtest.exit.ProfitTargetExitStrategy;
import com.optionsbacktest.backtest.exit.StopLossExitStrategy;
import com.optionsbacktest.backtest.exit.TimeStopExitStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the exit strategy chain for a run from the configured exit rules.
 * <p>
 * The order of {@code exit_rules} in the configuration does not matter: the chain is
 * sorted by each strategy's fixed priority, and an expiration exit is always appended.
 *
 * <h2>Strategy Order (by priority)</h2>
 * <ol>
 *   <li>ProfitTargetExitStrategy (10)</li>
 *   <li>StopLossExitStrategy (20)</li>
 *   <li>DeltaStopExitStrategy (30)</li>
 *   <li>IndicatorExitStrategy (40)</li>
 *   <li>TimeStopExitStrategy (50)</li>
 *   <li>ExpirationExitStrategy (1000)</li>
 * </ol>
 *
 * @see ExitStrategy
 */
@Slf4j
public class ExitStrategyBuilder {

    private final List<ExitRuleConfig> rules;

    public ExitStrategyBuilder(StrategyConfig config) {
        this.rules = config.getExitRules();
    }

    /**
     * Builds the sorted strategy list. The configuration must already be validated.
     *
     * @return strategies sorted by priority, ending with expiration
     */
    public List<ExitStrategy> build() {
        List<ExitStrategy> strategies = new ArrayList<>();

        for (ExitRuleConfig rule : rules) {
            ExitStrategy strategy = switch (rule.getCondition()) {
                case PROFIT_TARGET -> new ProfitTargetExitStrategy(rule.getThreshold());
                case STOP_LOSS -> new StopLossExitStrategy(rule.getThreshold());
                case DELTA_STOP -> new DeltaStopExitStrategy(rule.getMinDelta(), rule.isIvAdjusted());
                case INDICATOR_EXIT -> new IndicatorExitStrategy(rule.getIndicator(), rule.getPeriod(),
                        rule.getIndicator() == ExitRuleConfig.Indicator.RSI ? rule.getExitLevel() : rule.getExitAtBandPct(),
                        rule.getStdDev());
                case TIME_STOP -> new TimeStopExitStrategy(rule.getMaxDaysHeld(), rule.getDteThreshold());
            };
            strategies.add(strategy);
        }
        strategies.add(new ExpirationExitStrategy());

        strategies.sort(Comparator.comparingInt(ExitStrategy::getPriority));

        log.info("Built {} exit strategies: {}", strategies.size(),
                strategies.stream().map(s -> s.getName() + "(" + s.getPriority() + ")").toList());
        return strategies;
    }
}
