package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.adapter.MarketSnapshotProvider;
import com.optionsbacktest.backtest.config.DeltaCriteria;
import com.optionsbacktest.backtest.config.ExitStrategyBuilder;
import com.optionsbacktest.backtest.config.OptionSelectionConfig;
import com.optionsbacktest.backtest.config.RiskConfig;
import com.optionsbacktest.backtest.config.StrategyConfig;
import com.optionsbacktest.backtest.dto.BacktestResult;
import com.optionsbacktest.backtest.dto.BacktestResult.BacktestStatus;
import com.optionsbacktest.backtest.dto.ClosedTrade;
import com.optionsbacktest.backtest.dto.EquityPoint;
import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import com.optionsbacktest.backtest.dto.OptionRight;
import com.optionsbacktest.backtest.dto.PerformanceMetrics;
import com.optionsbacktest.backtest.exit.ExitContext;
import com.optionsbacktest.backtest.exit.ExitReason;
import com.optionsbacktest.backtest.exit.ExitResult;
import com.optionsbacktest.backtest.exit.ExitStrategyEvaluator;
import com.optionsbacktest.backtest.filter.MarketConditionFilter;
import com.optionsbacktest.backtest.filter.MarketFilterResult;
import com.optionsbacktest.backtest.filter.MarketHistory;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Day-by-day simulation of one strategy over one date range.
 * <p>
 * For every trading day, in ascending order, the engine:
 * <ol>
 *   <li>marks every open position to the day's quotes and extends its Greeks history</li>
 *   <li>evaluates exit rules over a stable copy of the open position ids, applying the
 *       closures once the pass is complete</li>
 *   <li>attempts one entry: capacity, entry spacing, snapshot presence, market filters,
 *       contract selection and sizing must all agree</li>
 *   <li>appends the day's equity point</li>
 * </ol>
 * After the last day every position still open is closed at its mark with
 * {@link ExitReason#END_OF_PERIOD}. Collaborators only ever see the current day's snapshot
 * and history up to the current day.
 * <p>
 * Thread safety: NOT thread-safe. Each run creates its own engine instance.
 */
@Slf4j
public class BacktestEngine {

    public enum State {
        INITIALIZING,
        RUNNING,
        FINALIZING,
        COMPLETED
    }

    /** Delta compliance band used when the configuration sets no tolerance. */
    static final double DEFAULT_COMPLIANCE_TOLERANCE = 0.05;

    // ==================== CONFIGURATION ====================

    private final StrategyConfig config;
    private final LocalDate from;
    private final LocalDate to;
    private final int tradingDaysPerYear;

    // ==================== COLLABORATORS ====================

    private final BacktestContext context;
    private final AuditLog auditLog = new AuditLog();
    private final PositionTracker tracker = new PositionTracker(auditLog);
    private final TradeRecorder recorder = new TradeRecorder(auditLog);
    private final MarketConditionFilter marketFilter = new MarketConditionFilter();
    private final OptionSelector selector = new OptionSelector();
    private final PositionSizer sizer;
    private final ExitStrategyEvaluator exitEvaluator;

    private State state = State.INITIALIZING;

    public BacktestEngine(StrategyConfig config, MarketSnapshotProvider provider,
                          LocalDate from, LocalDate to, String runId, int tradingDaysPerYear) {
        if (provider == null) {
            throw new BacktestException(BacktestException.ErrorCode.NO_MARKET_DATA,
                    "No market snapshot provider supplied for run " + runId);
        }
        if (from == null || to == null || from.isAfter(to)) {
            throw new BacktestException(BacktestException.ErrorCode.INVALID_DATE_RANGE,
                    "Invalid date range: " + from + " to " + to);
        }
        this.config = config;
        this.from = from;
        this.to = to;
        this.tradingDaysPerYear = tradingDaysPerYear;

        RiskConfig risk = config.getRisk();
        this.context = new BacktestContext(runId, provider, risk.getInitialCapital());
        this.sizer = new PositionSizer(risk.getPositionSizeFraction(), risk.getCommissionPerContract(),
                risk.getMaxContractsPerTrade());
        this.exitEvaluator = new ExitStrategyEvaluator(new ExitStrategyBuilder(config).build());
    }

    /**
     * Runs the simulation to completion. May be called once.
     *
     * @return completed result with trades, equity curve, metrics and audit log
     */
    public BacktestResult run() {
        if (state != State.INITIALIZING) {
            throw new IllegalStateException("Engine for run " + context.getRunId() + " already " + state);
        }
        long startMs = System.currentTimeMillis();

        List<LocalDate> days = context.getProvider().tradingDays(from, to);
        auditLog.record(from, AuditEventType.RUN_START, String.format(Locale.ROOT,
                "run %s strategy '%s' on %s: %d trading day(s) %s..%s, capital %.2f",
                context.getRunId(), config.getName(), config.getUnderlying(), days.size(), from, to,
                context.getInitialCapital()));
        log.info("Backtest {} starting: strategy={}, underlying={}, days={}, range={}..{}",
                context.getRunId(), config.getName(), config.getUnderlying(), days.size(), from, to);

        state = State.RUNNING;
        for (int i = 0; i < days.size(); i++) {
            context.setDayIndex(i);
            simulateDay(days.get(i));
        }

        state = State.FINALIZING;
        LocalDate lastDay = days.isEmpty() ? to : days.get(days.size() - 1);
        forceCloseRemaining(lastDay);

        List<ClosedTrade> trades = recorder.getLedger();
        List<EquityPoint> curve = context.getEquityCurve();
        PerformanceMetrics metrics = new PerformanceMetricsCalculator(tradingDaysPerYear)
                .compute(trades, curve, context.getInitialCapital());

        auditLog.record(lastDay, AuditEventType.RUN_END, String.format(Locale.ROOT,
                "run %s finished: %d trade(s), final value %.2f, total return %.4f",
                context.getRunId(), trades.size(), metrics.getFinalValue(), metrics.getTotalReturn()));
        state = State.COMPLETED;

        long durationMs = System.currentTimeMillis() - startMs;
        log.info("Backtest {} completed: {} trades, final={}, return={}, duration={}ms",
                context.getRunId(), trades.size(), String.format(Locale.ROOT, "%.2f", metrics.getFinalValue()),
                String.format(Locale.ROOT, "%.4f", metrics.getTotalReturn()), durationMs);

        return BacktestResult.builder()
                .runId(context.getRunId())
                .strategyName(config.getName())
                .underlyingSymbol(config.getUnderlying())
                .status(BacktestStatus.COMPLETED)
                .startDate(from)
                .endDate(to)
                .initialCapital(context.getInitialCapital())
                .finalValue(metrics.getFinalValue())
                .trades(List.copyOf(trades))
                .equityCurve(List.copyOf(curve))
                .metrics(metrics)
                .auditLog(auditLog.lines())
                .executionDurationMs(durationMs)
                .build();
    }

    public State getState() {
        return state;
    }

    // ==================== DAY LOOP ====================

    private void simulateDay(LocalDate date) {
        context.setCurrentDate(date);
        Optional<MarketSnapshot> snapshot = readSnapshot(date);

        if (snapshot.isPresent()) {
            context.getHistory().append(snapshot.get());
            auditAnomalies(date, snapshot.get());
        } else {
            auditLog.record(date, AuditEventType.DATA_GAP, "no market snapshot; marks carried, entries blocked");
        }

        // (1) mark
        for (Position position : context.openPositions()) {
            tracker.markToMarket(position, date, snapshot);
        }

        // (2) exits
        double underlyingToday = snapshot.map(MarketSnapshot::getUnderlyingPrice).orElse(Double.NaN);
        evaluateExits(date, underlyingToday);

        // (3) entry
        snapshot.ifPresent(s -> attemptEntry(date, s));

        // (4) equity
        EquityPoint point = context.appendEquityPoint(date);
        auditLog.record(date, AuditEventType.EQUITY, String.format(Locale.ROOT,
                "cash %.2f, positions %.2f, total %.2f, open %d",
                point.cash(), point.positionValue(), point.totalValue(), point.openPositions()));
    }

    private Optional<MarketSnapshot> readSnapshot(LocalDate date) {
        Optional<MarketSnapshot> snapshot = context.getProvider().snapshotFor(date);
        if (snapshot.isPresent() && !date.equals(snapshot.get().getDate())) {
            log.warn("Provider returned snapshot for {} when asked for {}, treating as gap",
                    snapshot.get().getDate(), date);
            return Optional.empty();
        }
        return snapshot;
    }

    private void auditAnomalies(LocalDate date, MarketSnapshot snapshot) {
        int anomalies = 0;
        for (OptionQuote quote : snapshot.getQuotes()) {
            if (quote.isAnomalous()) {
                anomalies++;
            }
        }
        if (anomalies > 0) {
            auditLog.record(date, AuditEventType.QUOTE_ANOMALY,
                    anomalies + " of " + snapshot.size() + " quote(s) skipped as anomalous");
        }
    }

    // ==================== EXITS ====================

    private record PendingClose(Position position, ExitResult decision, double exitPrice) {
    }

    private void evaluateExits(LocalDate date, double underlyingToday) {
        List<PendingClose> closures = new ArrayList<>();
        MarketHistory history = context.getHistory();

        for (String id : context.openIdsSnapshot()) {
            Position position = context.position(id);
            ExitContext ctx = ExitContext.builder()
                    .positionId(id)
                    .contract(position.getContract())
                    .contracts(position.getContracts())
                    .entryCost(position.getEntryCost())
                    .entryGreeks(position.getEntryGreeks())
                    .currentDate(date)
                    .currentMark(position.getCurrentMark())
                    .markStale(position.isMarkStale())
                    .currentGreeks(position.latestGreeks())
                    .daysHeld(position.getDaysHeld())
                    .underlyingPrice(underlyingToday)
                    .history(history)
                    .build();

            ExitResult decision = exitEvaluator.evaluate(ctx);
            if (decision.requiresAction()) {
                double exitPrice = decision.getReason() == ExitReason.EXPIRATION
                        ? expirationPrice(position, underlyingToday)
                        : position.getCurrentMark();
                closures.add(new PendingClose(position, decision, exitPrice));
            }
        }

        for (PendingClose pending : closures) {
            closePosition(pending.position(), pending.decision().getReason(), pending.decision().getDetail(),
                    pending.exitPrice(), date, underlyingToday);
        }
    }

    /**
     * Fresh mark when available, else intrinsic value at today's underlying, else the carried mark.
     */
    static double expirationPrice(Position position, double underlyingToday) {
        if (!position.isMarkStale()) {
            return position.getCurrentMark();
        }
        if (!Double.isNaN(underlyingToday)) {
            double strike = position.getContract().strike();
            return position.getContract().right() == OptionRight.CALL
                    ? Math.max(0.0, underlyingToday - strike)
                    : Math.max(0.0, strike - underlyingToday);
        }
        return position.getCurrentMark();
    }

    private void closePosition(Position position, ExitReason reason, String detail,
                               double exitPrice, LocalDate date, double underlyingPrice) {
        ClosedTrade trade = recorder.recordClose(position, reason, detail, exitPrice, date, underlyingPrice);
        context.close(position.getId(), trade.exitValue());
    }

    private void forceCloseRemaining(LocalDate lastDay) {
        if (context.openCount() == 0) {
            return;
        }
        MarketHistory history = context.getHistory();
        double underlying = !history.isEmpty() && lastDay.equals(history.lastDate())
                ? history.lastClose() : Double.NaN;
        log.info("Force-closing {} open position(s) at end of period {}", context.openCount(), lastDay);
        for (String id : context.openIdsSnapshot()) {
            Position position = context.position(id);
            closePosition(position, ExitReason.END_OF_PERIOD,
                    "end_of_period: still open after " + lastDay, position.getCurrentMark(), lastDay, underlying);
        }
    }

    // ==================== ENTRY ====================

    private void attemptEntry(LocalDate date, MarketSnapshot snapshot) {
        RiskConfig risk = config.getRisk();

        if (context.openCount() >= risk.getMaxConcurrentPositions()) {
            recorder.recordSkip(date, "max concurrent positions reached (" + context.openCount() + ")");
            return;
        }
        int lastEntry = context.getLastEntryDayIndex();
        if (lastEntry >= 0 && context.getDayIndex() - lastEntry < risk.getMinDaysBetweenEntries()) {
            recorder.recordSkip(date, "entry spacing: " + (context.getDayIndex() - lastEntry)
                    + " day(s) since last entry, need " + risk.getMinDaysBetweenEntries());
            return;
        }

        MarketFilterResult filter = marketFilter.allowEntry(date, context.getHistory(),
                config.getMarketFilters(), config.getOptionSelection().getType());
        auditLog.record(date, AuditEventType.FILTER, (filter.allowed() ? "allow: " : "block: ") + filter.reason());
        if (!filter.allowed()) {
            recorder.recordSkip(date, "market filter blocked entry");
            return;
        }

        OptionSelectionConfig selection = config.getOptionSelection();
        OptionSelector.SelectionResult selected = selector.select(snapshot, snapshot.getUnderlyingPrice(),
                selection, context.heldContracts());
        if (!selected.isSelected()) {
            recorder.recordSkip(date, selected.rationale());
            return;
        }

        OptionQuote quote = selected.contract().get();
        double fill = quote.getClose();
        PositionSizer.SizingResult sizing = sizer.size(context.getCash(), fill);
        if (!sizing.isTradable()) {
            recorder.recordSkip(date, sizing.rationale());
            return;
        }

        DeltaCriteria delta = selection.getDelta();
        double tolerance = delta.hasTolerance() ? delta.getTolerance() : DEFAULT_COMPLIANCE_TOLERANCE;
        boolean deltaCompliant = Math.abs(Math.abs(quote.getDelta()) - delta.getTarget()) <= tolerance + 1e-9;
        boolean dteCompliant = selection.getDte().contains(quote.daysToExpiration(date));

        Position position = new Position(context.nextPositionId(), config.getUnderlying(), date, quote,
                sizing.contracts(), fill, risk.getCommissionPerContract(), delta.getTarget(),
                deltaCompliant, dteCompliant, selected.relaxed());
        context.open(position);
        context.setLastEntryDayIndex(context.getDayIndex());

        recorder.recordOpen(position, selected.rationale() + "; " + sizing.rationale());
    }
}
