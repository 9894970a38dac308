package com.optionsbacktest.backtest.exit;

/**
 * Forced exit on or after the contract's expiration date. Always the last rule checked.
 */
public class ExpirationExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 1000;

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        if (ctx.getCurrentDate().isBefore(ctx.getExpiration())) {
            return ExitResult.noExit();
        }
        return ExitResult.exit(ExitReason.EXPIRATION, "expiration: contract expires " + ctx.getExpiration());
    }

    @Override
    public String getName() {
        return "Expiration";
    }
}
