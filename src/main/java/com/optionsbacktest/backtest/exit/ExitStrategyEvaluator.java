package com.optionsbacktest.backtest.exit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Runs a fixed, priority-ordered list of exit strategies for a position and returns the
 * first that fires.
 * <p>
 * Two rules that would both fire on the same day always resolve to the one with the lower
 * priority number. Strategies with equal priority keep their configured order.
 *
 * @see ExitStrategy
 * @see ExitContext
 */
@Slf4j
public class ExitStrategyEvaluator {

    /** List of exit strategies, sorted by priority */
    @Getter
    private final List<ExitStrategy> exitStrategies;

    public ExitStrategyEvaluator(List<ExitStrategy> exitStrategies) {
        List<ExitStrategy> sorted = new ArrayList<>(exitStrategies);
        sorted.sort(Comparator.comparingInt(ExitStrategy::getPriority));
        this.exitStrategies = Collections.unmodifiableList(sorted);
    }

    /**
     * @param ctx the position's state today
     * @return the first firing rule's result, or {@link ExitResult#noExit()}
     */
    public ExitResult evaluate(ExitContext ctx) {
        for (ExitStrategy strategy : exitStrategies) {
            if (!strategy.isEnabled(ctx)) {
                continue;
            }
            ExitResult result = strategy.evaluate(ctx);
            if (result.requiresAction()) {
                log.debug("Exit triggered by {} for {} on {}: {}",
                        strategy.getName(), ctx.getPositionId(), ctx.getCurrentDate(), result.getDetail());
                return result;
            }
        }
        return ExitResult.noExit();
    }
}
