package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.dto.ClosedTrade;
import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import com.optionsbacktest.backtest.exit.ExitReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns position lifecycles into immutable {@link ClosedTrade} records and writes the
 * corresponding audit lines.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeRecorder {

    private final AuditLog auditLog;
    private final List<ClosedTrade> ledger = new ArrayList<>();

    public void recordOpen(Position position, String rationale) {
        auditLog.record(position.getEntryDate(), AuditEventType.ENTRY, position.getContract().toString(),
                position.getEntryPrice(), String.format(Locale.ROOT,
                        "%s bought %d contract(s), cost %.2f incl. commission %.2f; %s",
                        position.getId(), position.getContracts(), position.getEntryCost(),
                        position.getCommission(), rationale));
    }

    /**
     * Builds the trade for a position leaving the book.
     *
     * @param exitUnderlyingPrice underlying price on the exit day, {@code NaN} if unknown
     */
    public ClosedTrade recordClose(Position position, ExitReason reason, String detail,
                                   double exitPrice, LocalDate exitDate, double exitUnderlyingPrice) {
        double exitValue = exitPrice * position.getContracts() * 100.0;
        double realizedPnl = exitValue - position.getEntryCost();
        double pnlPct = realizedPnl / position.getEntryCost();
        GreeksSnapshot exitGreeks = position.latestGreeks();

        ClosedTrade trade = ClosedTrade.builder()
                .tradeId(position.getId())
                .underlyingSymbol(position.getUnderlyingSymbol())
                .contract(position.getContract())
                .entryDate(position.getEntryDate())
                .entryPrice(position.getEntryPrice())
                .contracts(position.getContracts())
                .entryCost(position.getEntryCost())
                .commission(position.getCommission())
                .entryUnderlyingPrice(position.getEntryUnderlyingPrice())
                .entryBid(position.getEntryQuote().getBid())
                .entryAsk(position.getEntryQuote().getAsk())
                .entrySpreadPct(position.getEntryQuote().spreadPct())
                .entryVolume(position.getEntryQuote().getVolume())
                .entryOpenInterest(position.getEntryQuote().getOpenInterest())
                .entryDte(position.getEntryQuote().daysToExpiration(position.getEntryDate()))
                .entryGreeks(position.getEntryGreeks())
                .exitDate(exitDate)
                .exitPrice(exitPrice)
                .exitUnderlyingPrice(exitUnderlyingPrice)
                .exitGreeks(exitGreeks)
                .exitReason(reason)
                .exitDetail(detail)
                .realizedPnl(realizedPnl)
                .pnlPct(pnlPct)
                .daysHeld(position.getDaysHeld())
                .calendarDaysHeld(ChronoUnit.DAYS.between(position.getEntryDate(), exitDate))
                .greeksHistory(List.copyOf(position.getGreeksHistory()))
                .targetDelta(position.getTargetDelta())
                .deltaCompliant(position.isDeltaCompliant())
                .dteCompliant(position.isDteCompliant())
                .relaxedSelection(position.isRelaxedSelection())
                .build();
        ledger.add(trade);

        auditLog.record(exitDate, AuditEventType.EXIT, position.getContract().toString(), exitPrice,
                String.format(Locale.ROOT, "%s %s after %d day(s): proceeds %.2f, pnl %.2f (%.2f%%); %s",
                        position.getId(), reason.getCode(), position.getDaysHeld(), exitValue,
                        realizedPnl, pnlPct * 100.0, detail));
        return trade;
    }

    public void recordSkip(LocalDate date, String reason) {
        auditLog.record(date, AuditEventType.ENTRY_SKIPPED, reason);
    }

    public List<ClosedTrade> getLedger() {
        return Collections.unmodifiableList(ledger);
    }
}
