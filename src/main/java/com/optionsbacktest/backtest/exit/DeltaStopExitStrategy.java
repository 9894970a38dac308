package com.optionsbacktest.backtest.exit;

import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Exits when the contract's absolute delta decays below a floor.
 * <p>
 * With IV adjustment the floor scales by {@code 2 - currentIv / entryIv} and is clamped
 * to [0.05, 0.20]: rising volatility lowers the floor, falling volatility raises it.
 */
@Slf4j
public class DeltaStopExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 30;

    static final double ADJUSTED_FLOOR_MIN = 0.05;
    static final double ADJUSTED_FLOOR_MAX = 0.20;

    private final double minDelta;
    private final boolean ivAdjusted;

    public DeltaStopExitStrategy(double minDelta, boolean ivAdjusted) {
        this.minDelta = minDelta;
        this.ivAdjusted = ivAdjusted;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return ctx.getCurrentGreeks() != null;
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        double floor = effectiveFloor(ctx.getEntryGreeks(), ctx.getCurrentGreeks());
        double absDelta = Math.abs(ctx.getCurrentGreeks().delta());
        if (absDelta >= floor) {
            return ExitResult.noExit();
        }
        StringBuilder sb = getExitReasonBuilder();
        sb.append("delta stop: |delta| ");
        sb.append(String.format(Locale.ROOT, "%.3f", absDelta));
        sb.append(" < ");
        sb.append(String.format(Locale.ROOT, "%.3f", floor));
        if (ctx.getCurrentGreeks().stale()) {
            sb.append(" (stale greeks)");
        }
        log.debug("[{}] {}", ctx.getPositionId(), sb);
        return ExitResult.exit(ExitReason.DELTA_STOP, sb.toString());
    }

    double effectiveFloor(GreeksSnapshot entry, GreeksSnapshot current) {
        if (!ivAdjusted || entry == null || entry.impliedVolatility() <= 0 || current.impliedVolatility() <= 0) {
            return minDelta;
        }
        double ivRatio = current.impliedVolatility() / entry.impliedVolatility();
        double adjusted = minDelta * (2.0 - ivRatio);
        return Math.max(ADJUSTED_FLOOR_MIN, Math.min(ADJUSTED_FLOOR_MAX, adjusted));
    }

    @Override
    public String getName() {
        return "DeltaStop";
    }
}
