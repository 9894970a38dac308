package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Marks open positions to each day's quotes and extends their Greeks history.
 * <p>
 * Lookup is by exact contract key. When the contract, or the whole day, is missing the
 * previous mark is carried forward, a stale copy of the last Greeks is appended, and a
 * stale-mark line goes to the audit log.
 */
@Slf4j
@RequiredArgsConstructor
public class PositionTracker {

    private final AuditLog auditLog;

    /**
     * Advances one open position to {@code date}.
     *
     * @param snapshot the day's snapshot, empty on a data-gap day
     * @return true if the position was marked from a fresh quote
     */
    public boolean markToMarket(Position position, LocalDate date, Optional<MarketSnapshot> snapshot) {
        position.advanceDay();

        Optional<OptionQuote> quote = snapshot.flatMap(s -> s.find(position.getContract()));
        if (quote.isPresent()) {
            OptionQuote q = quote.get();
            Optional<Double> mark = markPrice(q);
            if (mark.isPresent()) {
                position.markFresh(date, mark.get(), q.greeks());
                return true;
            }
        }

        position.markStale(date);
        String why = snapshot.isEmpty() ? "no snapshot for the day"
                : quote.isEmpty() ? "contract missing from snapshot" : "quote has no usable price";
        auditLog.record(date, AuditEventType.MARK_STALE, position.getContract().toString(),
                position.getCurrentMark(), position.getId() + " carried mark from " + position.getLastMarkDate() + " (" + why + ")");
        return false;
    }

    /**
     * Close price, or the bid/ask mid when the contract did not trade (close of zero).
     */
    static Optional<Double> markPrice(OptionQuote quote) {
        if (quote.getClose() > 0) {
            return Optional.of(quote.getClose());
        }
        if (!quote.isAnomalous() && quote.mid() > 0) {
            return Optional.of(quote.mid());
        }
        if (quote.getClose() == 0 && !quote.isAnomalous()) {
            return Optional.of(0.0);
        }
        return Optional.empty();
    }
}
