package com.optionsbacktest.backtest.exit;

import lombok.extern.slf4j.Slf4j;

/**
 * Exits once the position's market value falls to {@code entryCost * (1 - threshold)}.
 */
@Slf4j
public class StopLossExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 20;

    private final double threshold;

    /**
     * @param threshold tolerated loss as a positive fraction of entry cost (0.5 = -50%)
     */
    public StopLossExitStrategy(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        double stopValue = ctx.getEntryCost() * (1.0 - threshold);
        double value = ctx.getCurrentValue();
        if (value > stopValue) {
            return ExitResult.noExit();
        }
        StringBuilder sb = getExitReasonBuilder();
        sb.append("stop loss: value ");
        appendDouble(sb, value);
        sb.append(" <= ");
        appendDouble(sb, stopValue);
        sb.append(" (pnl ");
        appendPercent(sb, ctx.getUnrealizedPnlPct());
        sb.append(", limit -");
        appendPercent(sb, threshold);
        sb.append(')');
        log.debug("[{}] {}", ctx.getPositionId(), sb);
        return ExitResult.exit(ExitReason.STOP_LOSS, sb.toString());
    }

    @Override
    public String getName() {
        return "StopLoss";
    }
}
