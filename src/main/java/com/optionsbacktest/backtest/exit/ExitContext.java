package com.optionsbacktest.backtest.exit;

import com.optionsbacktest.backtest.dto.ContractKey;
import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import com.optionsbacktest.backtest.dto.OptionRight;
import com.optionsbacktest.backtest.filter.MarketHistory;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * State of one open position on one simulated day, as seen by the exit rules.
 * <p>
 * Built by the engine after the day's mark-to-market. Holds only data observable on or
 * before {@link #currentDate}.
 */
@Getter
@Builder
public class ExitContext {

    // ==================== POSITION ====================

    private final String positionId;

    private final ContractKey contract;

    private final int contracts;

    /** Fill x contracts x 100 + entry commission, fixed at open. */
    private final double entryCost;

    private final GreeksSnapshot entryGreeks;

    // ==================== TODAY ====================

    private final LocalDate currentDate;

    /** Per-share mark; carried from an earlier day when {@link #markStale}. */
    private final double currentMark;

    private final boolean markStale;

    /** Latest Greeks, possibly a stale copy. */
    private final GreeksSnapshot currentGreeks;

    /** Trading days since entry; 0 on the entry day. */
    private final int daysHeld;

    /** Underlying price today, {@code NaN} on a data-gap day. */
    private final double underlyingPrice;

    /** Underlying observations up to and including today. */
    private final MarketHistory history;

    // ==================== DERIVED ====================

    public OptionRight getRight() {
        return contract.right();
    }

    public LocalDate getExpiration() {
        return contract.expiration();
    }

    public long getDaysToExpiration() {
        return ChronoUnit.DAYS.between(currentDate, contract.expiration());
    }

    /** Market value of the whole position at the current mark. */
    public double getCurrentValue() {
        return currentMark * contracts * 100.0;
    }

    public double getUnrealizedPnl() {
        return getCurrentValue() - entryCost;
    }

    public double getUnrealizedPnlPct() {
        return entryCost > 0 ? getUnrealizedPnl() / entryCost : 0.0;
    }

    public boolean hasUnderlyingToday() {
        return !Double.isNaN(underlyingPrice) && history != null && currentDate.equals(history.lastDate());
    }
}
