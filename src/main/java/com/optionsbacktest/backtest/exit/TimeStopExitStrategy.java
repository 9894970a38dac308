package com.optionsbacktest.backtest.exit;

import lombok.extern.slf4j.Slf4j;

/**
 * Exits after a maximum holding period and/or once few enough days remain to expiration.
 */
@Slf4j
public class TimeStopExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 50;

    private final Integer maxDaysHeld;
    private final Integer dteThreshold;

    /**
     * @param maxDaysHeld  trading days after entry, or {@code null}
     * @param dteThreshold calendar days to expiration, or {@code null}
     */
    public TimeStopExitStrategy(Integer maxDaysHeld, Integer dteThreshold) {
        if (maxDaysHeld == null && dteThreshold == null) {
            throw new IllegalArgumentException("Time stop needs max days held or a DTE threshold");
        }
        this.maxDaysHeld = maxDaysHeld;
        this.dteThreshold = dteThreshold;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        if (maxDaysHeld != null && ctx.getDaysHeld() >= maxDaysHeld) {
            String detail = "time stop: held " + ctx.getDaysHeld() + " days >= " + maxDaysHeld;
            log.debug("[{}] {}", ctx.getPositionId(), detail);
            return ExitResult.exit(ExitReason.TIME_STOP, detail);
        }
        long dte = ctx.getDaysToExpiration();
        if (dteThreshold != null && dte <= dteThreshold) {
            String detail = "time stop: " + dte + " DTE <= " + dteThreshold;
            log.debug("[{}] {}", ctx.getPositionId(), detail);
            return ExitResult.exit(ExitReason.TIME_STOP, detail);
        }
        return ExitResult.noExit();
    }

    @Override
    public String getName() {
        return "TimeStop";
    }
}
