package com.optionsbacktest.backtest.exit;

import lombok.extern.slf4j.Slf4j;

/**
 * Exits once the position's market value reaches {@code entryCost * (1 + threshold)}.
 */
@Slf4j
public class ProfitTargetExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 10;

    private final double threshold;

    /**
     * @param threshold gain as a fraction of entry cost (0.5 = +50%)
     */
    public ProfitTargetExitStrategy(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        double targetValue = ctx.getEntryCost() * (1.0 + threshold);
        double value = ctx.getCurrentValue();
        if (value < targetValue) {
            return ExitResult.noExit();
        }
        StringBuilder sb = getExitReasonBuilder();
        sb.append("profit target: value ");
        appendDouble(sb, value);
        sb.append(" >= ");
        appendDouble(sb, targetValue);
        sb.append(" (pnl ");
        appendPercent(sb, ctx.getUnrealizedPnlPct());
        sb.append(", target ");
        appendPercent(sb, threshold);
        sb.append(')');
        log.debug("[{}] {}", ctx.getPositionId(), sb);
        return ExitResult.exit(ExitReason.PROFIT_TARGET, sb.toString());
    }

    @Override
    public String getName() {
        return "ProfitTarget";
    }
}
