/**
 * Exit rules for open positions.
 * <p>
 * Each rule is an {@link com.optionsbacktest.backtest.exit.ExitStrategy}: a pure predicate over
 * an {@link com.optionsbacktest.backtest.exit.ExitContext}. The
 * {@link com.optionsbacktest.backtest.exit.ExitStrategyEvaluator} checks them once per position
 * per simulated day, in priority order, and the first that fires closes the position that day.
 *
 * <h2>Evaluation Order</h2>
 * <ol>
 *   <li>Profit target (10)</li>
 *   <li>Stop loss (20)</li>
 *   <li>Delta stop (30)</li>
 *   <li>Indicator exits (40)</li>
 *   <li>Time stop (50)</li>
 *   <li>Expiration (1000) - always appended</li>
 * </ol>
 */
package com.optionsbacktest.backtest.exit;
