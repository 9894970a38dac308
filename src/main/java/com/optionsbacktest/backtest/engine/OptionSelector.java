package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.config.DeltaCriteria;
import com.optionsbacktest.backtest.config.DteCriteria;
import com.optionsbacktest.backtest.config.LiquidityCriteria;
import com.optionsbacktest.backtest.config.OptionSelectionConfig;
import com.optionsbacktest.backtest.dto.ContractKey;
import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Picks the contract to buy from a day's chain.
 * <p>
 * Candidates pass, in order: quote sanity, option type, not already held, DTE window,
 * delta bounds, liquidity. Survivors are ranked by distance of |delta| from the target,
 * then narrower spread, then higher volume (strike, expiration and right settle any
 * remaining tie so the choice is deterministic).
 * <p>
 * When a delta tolerance is configured and no strictly liquid candidate lies within it,
 * the liquidity filter is relaxed once ({@code volume >= max(1, min_volume / 4)},
 * {@code bid > 0.01}, {@code ask > bid}, {@code spread <= 0.30} regardless of {@code max_spread_pct}) before
 * giving up. Without a tolerance there is no relaxed pass.
 * <p>
 * Stateless; no selection outcome is an error.
 */
@Slf4j
public class OptionSelector {

    static final double RELAXED_MAX_SPREAD_PCT = 0.30;
    static final double RELAXED_MIN_BID = 0.01;
    private static final double TOLERANCE_EPSILON = 1e-9;

    /**
     * Candidate counts after each stage, for the audit rationale.
     */
    public record Funnel(int total, int valid, int typed, int notHeld, int inDte, int inDelta, int liquid) {
        @Override
        public String toString() {
            return "chain " + total + " -> valid " + valid + " -> type " + typed + " -> not held " + notHeld
                    + " -> dte " + inDte + " -> delta " + inDelta + " -> liquid " + liquid;
        }
    }

    /**
     * Selection outcome. {@code contract} is empty when nothing qualified.
     */
    public record SelectionResult(Optional<OptionQuote> contract, boolean relaxed, int anomalies,
                                  Funnel funnel, String rationale) {
        public boolean isSelected() {
            return contract.isPresent();
        }
    }

    /**
     * @param snapshot        today's chain
     * @param underlyingPrice today's underlying price
     * @param selection       entry criteria
     * @param held            contracts of currently open positions
     */
    public SelectionResult select(MarketSnapshot snapshot, double underlyingPrice,
                                  OptionSelectionConfig selection, Collection<ContractKey> held) {
        LocalDate date = snapshot.getDate();
        DeltaCriteria delta = selection.getDelta();
        DteCriteria dte = selection.getDte();
        LiquidityCriteria liquidity = selection.getLiquidity();
        Set<ContractKey> heldKeys = new HashSet<>(held);

        List<OptionQuote> valid = filter(snapshot.getQuotes(), q -> !q.isAnomalous());
        int anomalies = snapshot.size() - valid.size();
        List<OptionQuote> typed = filter(valid, q -> selection.getType().accepts(q.getRight()));
        List<OptionQuote> notHeld = filter(typed, q -> !heldKeys.contains(q.key()));
        List<OptionQuote> inDte = filter(notHeld, q -> dte.contains(q.daysToExpiration(date)));
        List<OptionQuote> inDelta = filter(inDte, q -> withinDeltaBounds(q, delta));
        List<OptionQuote> liquid = filter(inDelta, q -> isLiquid(q, liquidity));
        Funnel funnel = new Funnel(snapshot.size(), valid.size(), typed.size(), notHeld.size(),
                inDte.size(), inDelta.size(), liquid.size());

        Comparator<OptionQuote> ranking = ranking(delta.getTarget());

        if (!delta.hasTolerance()) {
            Optional<OptionQuote> best = liquid.stream().min(ranking);
            return result(best, false, anomalies, funnel, delta, underlyingPrice);
        }

        Optional<OptionQuote> strict = liquid.stream()
                .filter(q -> withinTolerance(q, delta))
                .min(ranking);
        if (strict.isPresent() || !liquidity.isAllowRelaxation()) {
            return result(strict, false, anomalies, funnel, delta, underlyingPrice);
        }

        Optional<OptionQuote> relaxed = inDelta.stream()
                .filter(q -> isLiquidRelaxed(q, liquidity))
                .filter(q -> withinTolerance(q, delta))
                .min(ranking);
        if (relaxed.isPresent()) {
            log.debug("{} selection needed relaxed liquidity criteria", date);
        }
        return result(relaxed, relaxed.isPresent(), anomalies, funnel, delta, underlyingPrice);
    }

    // ==================== PREDICATES ====================

    static boolean isLiquid(OptionQuote q, LiquidityCriteria liquidity) {
        return q.getVolume() >= liquidity.getMinVolume()
                && q.getOpenInterest() >= liquidity.getMinOpenInterest()
                && q.mid() > 0
                && q.spreadPct() <= liquidity.getMaxSpreadPct();
    }

    static boolean isLiquidRelaxed(OptionQuote q, LiquidityCriteria liquidity) {
        long relaxedVolume = Math.max(1L, liquidity.getMinVolume() / 4);
        return q.getVolume() >= relaxedVolume
                && q.getBid() > RELAXED_MIN_BID
                && q.getAsk() > q.getBid()
                && q.spreadPct() <= RELAXED_MAX_SPREAD_PCT;
    }

    private static boolean withinDeltaBounds(OptionQuote q, DeltaCriteria delta) {
        double abs = Math.abs(q.getDelta());
        return (delta.getMin() == null || abs >= delta.getMin())
                && (delta.getMax() == null || abs <= delta.getMax());
    }

    private static boolean withinTolerance(OptionQuote q, DeltaCriteria delta) {
        return Math.abs(Math.abs(q.getDelta()) - delta.getTarget()) <= delta.getTolerance() + TOLERANCE_EPSILON;
    }

    static Comparator<OptionQuote> ranking(double targetDelta) {
        return Comparator.<OptionQuote>comparingDouble(q -> Math.abs(Math.abs(q.getDelta()) - targetDelta))
                .thenComparingDouble(OptionQuote::spreadPct)
                .thenComparing(Comparator.comparingLong(OptionQuote::getVolume).reversed())
                .thenComparingDouble(OptionQuote::getStrike)
                .thenComparing(OptionQuote::getExpiration)
                .thenComparing(OptionQuote::getRight);
    }

    private static List<OptionQuote> filter(List<OptionQuote> quotes, Predicate<OptionQuote> predicate) {
        List<OptionQuote> out = new ArrayList<>(quotes.size());
        for (OptionQuote q : quotes) {
            if (predicate.test(q)) {
                out.add(q);
            }
        }
        return out;
    }

    private static SelectionResult result(Optional<OptionQuote> chosen, boolean relaxed, int anomalies,
                                          Funnel funnel, DeltaCriteria delta, double underlyingPrice) {
        if (chosen.isEmpty()) {
            String rationale = "no suitable contract (" + funnel
                    + (delta.hasTolerance() ? String.format(Locale.ROOT, ", none within delta %.2f +/- %.2f",
                    delta.getTarget(), delta.getTolerance()) : "") + ")";
            return new SelectionResult(Optional.empty(), false, anomalies, funnel, rationale);
        }
        OptionQuote q = chosen.get();
        String rationale = String.format(Locale.ROOT,
                "selected %s delta %.3f (target %.2f) spread %.1f%% volume %d underlying %.2f%s [%s]",
                q.key(), q.getDelta(), delta.getTarget(), q.spreadPct() * 100.0, q.getVolume(), underlyingPrice,
                relaxed ? " via relaxed liquidity" : "", funnel);
        return new SelectionResult(chosen, relaxed, anomalies, funnel, rationale);
    }
}
