package com.optionsbacktest.backtest.exit;

import com.optionsbacktest.backtest.config.ExitRuleConfig.Indicator;
import com.optionsbacktest.backtest.dto.OptionRight;
import com.optionsbacktest.backtest.filter.TechnicalIndicators;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Exits on a technical signal in the underlying that works against the position's direction.
 * <ul>
 *   <li>RSI: calls exit when RSI &gt;= level, puts when RSI &lt;= level</li>
 *   <li>Bollinger: calls exit when the band position is &gt;= level, puts when &lt;= level</li>
 * </ul>
 * Not evaluated on days without an underlying price or without enough history.
 */
@Slf4j
public class IndicatorExitStrategy extends AbstractExitStrategy {

    public static final int PRIORITY = 40;

    static final double DEFAULT_RSI_LEVEL = 50.0;
    static final int DEFAULT_RSI_PERIOD = 14;
    static final int DEFAULT_BAND_PERIOD = 20;
    static final double DEFAULT_BAND_STD_DEV = 2.0;
    static final double DEFAULT_CALL_BAND_LEVEL = 0.9;
    static final double DEFAULT_PUT_BAND_LEVEL = 0.1;

    private final Indicator indicator;
    private final int period;
    private final Double level;
    private final double stdDev;

    /**
     * @param indicator which indicator to watch
     * @param period    lookback, {@code null} for the indicator's default
     * @param level     RSI level or band position, {@code null} for the default
     * @param stdDev    band width in standard deviations, {@code null} for 2
     */
    public IndicatorExitStrategy(Indicator indicator, Integer period, Double level, Double stdDev) {
        this.indicator = indicator;
        this.period = period != null ? period
                : indicator == Indicator.RSI ? DEFAULT_RSI_PERIOD : DEFAULT_BAND_PERIOD;
        this.level = level;
        this.stdDev = stdDev != null ? stdDev : DEFAULT_BAND_STD_DEV;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isEnabled(ExitContext ctx) {
        return ctx.hasUnderlyingToday();
    }

    @Override
    public ExitResult evaluate(ExitContext ctx) {
        List<Double> closes = ctx.getHistory().closes();
        boolean isCall = ctx.getRight() == OptionRight.CALL;

        if (indicator == Indicator.RSI) {
            OptionalDouble rsi = TechnicalIndicators.rsi(closes, period);
            if (rsi.isEmpty()) {
                return ExitResult.noExit();
            }
            double exitLevel = level != null ? level : DEFAULT_RSI_LEVEL;
            double value = rsi.getAsDouble();
            boolean fire = isCall ? value >= exitLevel : value <= exitLevel;
            if (!fire) {
                return ExitResult.noExit();
            }
            StringBuilder sb = getExitReasonBuilder();
            sb.append("indicator exit: RSI(").append(period).append(") ");
            appendDouble(sb, value);
            sb.append(isCall ? " >= " : " <= ");
            appendDouble(sb, exitLevel);
            log.debug("[{}] {}", ctx.getPositionId(), sb);
            return ExitResult.exit(ExitReason.INDICATOR_EXIT, sb.toString());
        }

        Optional<TechnicalIndicators.Bands> bands = TechnicalIndicators.bollinger(closes, period, stdDev);
        if (bands.isEmpty()) {
            return ExitResult.noExit();
        }
        double exitLevel = level != null ? level : isCall ? DEFAULT_CALL_BAND_LEVEL : DEFAULT_PUT_BAND_LEVEL;
        double position = bands.get().position(ctx.getUnderlyingPrice());
        boolean fire = isCall ? position >= exitLevel : position <= exitLevel;
        if (!fire) {
            return ExitResult.noExit();
        }
        StringBuilder sb = getExitReasonBuilder();
        sb.append("indicator exit: band position ");
        appendDouble(sb, position);
        sb.append(isCall ? " >= " : " <= ");
        appendDouble(sb, exitLevel);
        log.debug("[{}] {}", ctx.getPositionId(), sb);
        return ExitResult.exit(ExitReason.INDICATOR_EXIT, sb.toString());
    }

    @Override
    public String getName() {
        return indicator == Indicator.RSI ? "RsiExit" : "BollingerExit";
    }
}
