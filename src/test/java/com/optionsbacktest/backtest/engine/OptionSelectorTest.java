package com.optionsbacktest.backtest.engine;

import com.optionsbacktest.backtest.config.DeltaCriteria;
import com.optionsbacktest.backtest.config.DteCriteria;
import com.optionsbacktest.backtest.config.LiquidityCriteria;
import com.optionsbacktest.backtest.config.OptionSelectionConfig;
import com.optionsbacktest.backtest.config.OptionTypeBias;
import com.optionsbacktest.backtest.dto.MarketSnapshot;
import com.optionsbacktest.backtest.dto.OptionQuote;
import com.optionsbacktest.backtest.dto.OptionRight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.optionsbacktest.backtest.SnapshotFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OptionSelector: candidate funnel, ranking, relaxation.
 */
class OptionSelectorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 2);
    private static final LocalDate EXPIRY = DAY.plusDays(30);

    private OptionSelector selector;

    @BeforeEach
    void setUp() {
        selector = new OptionSelector();
    }

    private static OptionSelectionConfig config(OptionTypeBias type, Double tolerance, LiquidityCriteria liquidity) {
        return OptionSelectionConfig.builder()
                .type(type)
                .delta(DeltaCriteria.builder().target(0.40).tolerance(tolerance).build())
                .dte(DteCriteria.builder().target(30).min(20).max(60).build())
                .liquidity(liquidity)
                .build();
    }

    private static OptionSelectionConfig calls(Double tolerance) {
        return config(OptionTypeBias.CALL, tolerance, LiquidityCriteria.builder().build());
    }

    private OptionSelector.SelectionResult select(MarketSnapshot snapshot, OptionSelectionConfig config) {
        return selector.select(snapshot, snapshot.getUnderlyingPrice(), config, List.of());
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Should pick the contract closest to the target delta")
        void closestDelta() {
            MarketSnapshot snap = snapshot(DAY, 100.0,
                    call(DAY, 100.0, 95.0, EXPIRY, 6.0, 0.62),
                    call(DAY, 100.0, 102.0, EXPIRY, 2.0, 0.41),
                    call(DAY, 100.0, 105.0, EXPIRY, 1.0, 0.33));

            OptionSelector.SelectionResult result = select(snap, calls(null));

            assertTrue(result.isSelected());
            assertEquals(102.0, result.contract().get().getStrike());
            assertFalse(result.relaxed());
        }

        @Test
        @DisplayName("Should break delta ties by narrower spread, then higher volume")
        void tieBreaks() {
            OptionQuote wide = call(DAY, 100.0, 101.0, EXPIRY, 2.0, 0.40).toBuilder().bid(1.90).ask(2.10).build();
            OptionQuote narrow = call(DAY, 100.0, 102.0, EXPIRY, 2.0, 0.40);
            OptionQuote narrowBusy = call(DAY, 100.0, 103.0, EXPIRY, 2.0, 0.40).toBuilder().volume(5000).build();

            OptionSelector.SelectionResult result = select(snapshot(DAY, 100.0, wide, narrow, narrowBusy), calls(null));

            assertEquals(103.0, result.contract().get().getStrike());
        }

        @Test
        @DisplayName("Ranking is independent of chain order")
        void orderIndependent() {
            OptionQuote a = call(DAY, 100.0, 101.0, EXPIRY, 2.0, 0.40);
            OptionQuote b = call(DAY, 100.0, 102.0, EXPIRY, 2.0, 0.40);

            assertEquals(select(snapshot(DAY, 100.0, a, b), calls(null)).contract(),
                    select(snapshot(DAY, 100.0, b, a), calls(null)).contract());
        }
    }

    @Nested
    @DisplayName("Funnel")
    class FunnelTests {

        @Test
        @DisplayName("Should drop wrong type, held, out-of-window and anomalous contracts")
        void funnel() {
            OptionQuote put = quote(DAY, 100.0, 98.0, EXPIRY, OptionRight.PUT, 2.0, -0.40);
            OptionQuote held = call(DAY, 100.0, 102.0, EXPIRY, 2.0, 0.40);
            OptionQuote shortDated = call(DAY, 100.0, 102.0, DAY.plusDays(5), 1.0, 0.40);
            OptionQuote crossed = call(DAY, 100.0, 103.0, EXPIRY, 2.0, 0.40).toBuilder().bid(2.2).ask(2.0).build();
            OptionQuote eligible = call(DAY, 100.0, 104.0, EXPIRY, 1.5, 0.30);

            OptionSelector.SelectionResult result = selector.select(
                    snapshot(DAY, 100.0, put, held, shortDated, crossed, eligible), 100.0, calls(null),
                    List.of(held.key()));

            assertEquals(104.0, result.contract().get().getStrike());
            assertEquals(1, result.anomalies());
            assertEquals(new OptionSelector.Funnel(5, 4, 3, 2, 1, 1, 1), result.funnel());
        }

        @Test
        @DisplayName("Puts are ranked by absolute delta")
        void putsByAbsoluteDelta() {
            OptionQuote near = quote(DAY, 100.0, 97.0, EXPIRY, OptionRight.PUT, 2.0, -0.39);
            OptionQuote far = quote(DAY, 100.0, 90.0, EXPIRY, OptionRight.PUT, 0.8, -0.15);

            OptionSelector.SelectionResult result = select(snapshot(DAY, 100.0, far, near),
                    config(OptionTypeBias.PUT, null, LiquidityCriteria.builder().build()));

            assertEquals(97.0, result.contract().get().getStrike());
        }

        @Test
        @DisplayName("Should report no suitable contract with the funnel counts")
        void nothingQualifies() {
            OptionSelector.SelectionResult result = select(
                    snapshot(DAY, 100.0, call(DAY, 100.0, 100.0, DAY.plusDays(3), 2.0, 0.4)), calls(null));

            assertFalse(result.isSelected());
            assertTrue(result.rationale().startsWith("no suitable contract"));
            assertTrue(result.rationale().contains("dte 0"));
        }
    }

    @Nested
    @DisplayName("Delta tolerance and relaxation")
    class RelaxationTests {

        // Spread 0.20/1.00 = 20%: fails the 15% limit, passes the relaxed 30% limit
        private final OptionQuote illiquid = call(DAY, 100.0, 102.0, EXPIRY, 1.0, 0.41).toBuilder()
                .bid(0.90).ask(1.10).volume(40).build();

        @Test
        @DisplayName("Without a tolerance the closest liquid contract wins at any distance")
        void noToleranceTakesClosest() {
            OptionQuote distant = call(DAY, 100.0, 110.0, EXPIRY, 1.0, 0.15);

            OptionSelector.SelectionResult result = select(snapshot(DAY, 100.0, distant, illiquid), calls(null));

            assertEquals(110.0, result.contract().get().getStrike());
            assertFalse(result.relaxed());
        }

        @Test
        @DisplayName("Should relax liquidity once when nothing liquid lies within the tolerance")
        void relaxesLiquidity() {
            OptionQuote distant = call(DAY, 100.0, 110.0, EXPIRY, 1.0, 0.15);

            OptionSelector.SelectionResult result = select(snapshot(DAY, 100.0, distant, illiquid), calls(0.05));

            assertTrue(result.isSelected());
            assertTrue(result.relaxed());
            assertEquals(102.0, result.contract().get().getStrike());
        }

        @Test
        @DisplayName("Relaxation still requires volume of at least a quarter of the minimum")
        void relaxedVolumeFloor() {
            OptionQuote thin = illiquid.toBuilder().volume(24).build();

            assertFalse(select(snapshot(DAY, 100.0, thin), calls(0.05)).isSelected());
        }

        @Test
        @DisplayName("Should not relax when relaxation is disabled")
        void relaxationDisabled() {
            OptionSelectionConfig config = config(OptionTypeBias.CALL, 0.05,
                    LiquidityCriteria.builder().allowRelaxation(false).build());

            assertFalse(select(snapshot(DAY, 100.0, illiquid), config).isSelected());
        }

        @Test
        @DisplayName("Relaxed spread cap stays at 30% even when the configured limit is wider")
        void relaxedSpreadCapIsFixed() {
            OptionSelectionConfig wide = config(OptionTypeBias.CALL, 0.05,
                    LiquidityCriteria.builder().minVolume(100).maxSpreadPct(0.50).build());
            // Spread 0.40/1.00 = 40%
            OptionQuote wideSpread = illiquid.toBuilder().bid(0.80).ask(1.20).volume(30).build();

            OptionSelector.SelectionResult rejected = select(snapshot(DAY, 100.0, wideSpread), wide);
            OptionSelector.SelectionResult accepted = select(snapshot(DAY, 100.0, illiquid.toBuilder().volume(30).build()), wide);

            assertFalse(rejected.isSelected());
            assertFalse(OptionSelector.isLiquidRelaxed(wideSpread, wide.getLiquidity()));
            assertTrue(accepted.isSelected());
            assertTrue(accepted.relaxed());
        }

        @Test
        @DisplayName("Relaxed predicate bounds")
        void relaxedPredicate() {
            LiquidityCriteria liquidity = LiquidityCriteria.builder().minVolume(100).maxSpreadPct(0.15).build();

            assertTrue(OptionSelector.isLiquidRelaxed(illiquid, liquidity));
            assertFalse(OptionSelector.isLiquidRelaxed(illiquid.toBuilder().bid(0.01).ask(0.02).build(), liquidity));
            assertFalse(OptionSelector.isLiquidRelaxed(illiquid.toBuilder().bid(0.60).ask(1.40).build(), liquidity));
            assertFalse(OptionSelector.isLiquid(illiquid, liquidity));
        }
    }
}
