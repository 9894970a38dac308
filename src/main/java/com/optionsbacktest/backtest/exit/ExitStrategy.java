package com.optionsbacktest.backtest.exit;

/**
 * One exit rule, evaluated once per simulated day for every open position.
 * <p>
 * Implementations are pure predicates over {@link ExitContext}: they never mutate the
 * position or the context. The {@link ExitStrategyEvaluator} runs them in priority order
 * and stops at the first that fires.
 *
 * <h2>Priorities</h2>
 * <ul>
 *   <li>10: profit target</li>
 *   <li>20: stop loss</li>
 *   <li>30: delta stop</li>
 *   <li>40: indicator exits</li>
 *   <li>50: time stop</li>
 *   <li>1000: expiration (always present)</li>
 * </ul>
 *
 * @see ExitContext
 * @see ExitResult
 */
public interface ExitStrategy {

    /**
     * Strategy priority for evaluation order.
     * Lower values are evaluated first.
     *
     * @return priority value (lower = higher priority)
     */
    int getPriority();

    /**
     * Evaluates the rule against the position's state on the current day.
     *
     * @param ctx evaluation context for one position on one day
     * @return exit result (use {@link ExitResult#noExit()} for no action)
     */
    ExitResult evaluate(ExitContext ctx);

    /**
     * Human-readable name for logging and debugging.
     *
     * @return strategy name (e.g., "ProfitTarget", "DeltaStop")
     */
    String getName();

    /**
     * Check if this strategy is applicable for the current context.
     * <p>
     * Default implementation returns true.
     *
     * @param ctx evaluation context
     * @return true if strategy should be evaluated
     */
    default boolean isEnabled(ExitContext ctx) {
        return true;
    }
}
