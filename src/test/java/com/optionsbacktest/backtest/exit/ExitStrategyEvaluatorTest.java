package com.optionsbacktest.backtest.exit;

import com.optionsbacktest.backtest.config.ExitCondition;
import com.optionsbacktest.backtest.config.ExitRuleConfig;
import com.optionsbacktest.backtest.config.ExitStrategyBuilder;
import com.optionsbacktest.backtest.dto.ContractKey;
import com.optionsbacktest.backtest.dto.GreeksSnapshot;
import com.optionsbacktest.backtest.dto.OptionRight;
import com.optionsbacktest.backtest.filter.MarketHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static com.optionsbacktest.backtest.SnapshotFixtures.strategy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for priority ordering in ExitStrategyEvaluator and ExitStrategyBuilder.
 */
@ExtendWith(MockitoExtension.class)
class ExitStrategyEvaluatorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 1);

    private static ExitContext context(double mark, int daysHeld, LocalDate expiration) {
        GreeksSnapshot greeks = GreeksSnapshot.fresh(TODAY, 0.4, 0.05, -0.02, 0.1, 0.01, 0.2);
        return ExitContext.builder()
                .positionId("P-0001")
                .contract(new ContractKey(100.0, expiration, OptionRight.CALL))
                .contracts(1)
                .entryCost(500.0)
                .entryGreeks(greeks)
                .currentDate(TODAY)
                .currentMark(mark)
                .currentGreeks(greeks)
                .daysHeld(daysHeld)
                .underlyingPrice(100.0)
                .history(new MarketHistory())
                .build();
    }

    @Test
    @DisplayName("Profit target wins over a time stop firing the same day, whatever the list order")
    void lowerPriorityNumberWins() {
        ExitStrategyEvaluator evaluator = new ExitStrategyEvaluator(List.of(
                new TimeStopExitStrategy(1, null),
                new ProfitTargetExitStrategy(0.5)));

        ExitResult result = evaluator.evaluate(context(7.5, 5, TODAY.plusDays(30)));

        assertEquals(ExitReason.PROFIT_TARGET, result.getReason());
    }

    @Test
    @DisplayName("Later rules are not evaluated once one fires")
    void stopsAtFirstMatch() {
        ExitStrategy first = mock(ExitStrategy.class);
        ExitStrategy second = mock(ExitStrategy.class);
        when(first.getPriority()).thenReturn(1);
        when(second.getPriority()).thenReturn(2);
        when(first.isEnabled(any())).thenReturn(true);
        when(first.evaluate(any())).thenReturn(ExitResult.exit(ExitReason.STOP_LOSS, "first"));

        ExitStrategyEvaluator evaluator = new ExitStrategyEvaluator(List.of(second, first));
        ExitResult result = evaluator.evaluate(context(1.0, 0, TODAY.plusDays(30)));

        assertEquals("first", result.getDetail());
        verify(second, never()).evaluate(any());
    }

    @Test
    @DisplayName("Disabled rules are skipped")
    void skipsDisabledRules() {
        ExitStrategy disabled = mock(ExitStrategy.class);
        when(disabled.getPriority()).thenReturn(1);
        when(disabled.isEnabled(any())).thenReturn(false);

        ExitStrategyEvaluator evaluator = new ExitStrategyEvaluator(List.of(disabled, new ExpirationExitStrategy()));

        assertEquals(ExitReason.EXPIRATION, evaluator.evaluate(context(1.0, 0, TODAY)).getReason());
        verify(disabled, never()).evaluate(any());
    }

    @Test
    @DisplayName("No exit when nothing fires")
    void noExit() {
        ExitStrategyEvaluator evaluator = new ExitStrategyEvaluator(List.of(
                new ProfitTargetExitStrategy(0.5), new ExpirationExitStrategy()));

        ExitResult result = evaluator.evaluate(context(5.0, 0, TODAY.plusDays(30)));

        assertFalse(result.requiresAction());
        assertSame(ExitResult.NO_EXIT_RESULT, result);
    }

    @Test
    @DisplayName("Builder sorts configured rules by priority and always ends with expiration")
    void builderOrdersRules() {
        List<ExitStrategy> strategies = new ExitStrategyBuilder(strategy()
                .exitRules(List.of(
                        ExitRuleConfig.builder().condition(ExitCondition.TIME_STOP).maxDaysHeld(10).build(),
                        ExitRuleConfig.builder().condition(ExitCondition.INDICATOR_EXIT)
                                .indicator(ExitRuleConfig.Indicator.BOLLINGER).exitAtBandPct(0.95).build(),
                        ExitRuleConfig.builder().condition(ExitCondition.STOP_LOSS).threshold(0.4).build(),
                        ExitRuleConfig.builder().condition(ExitCondition.DELTA_STOP).minDelta(0.1).build(),
                        ExitRuleConfig.builder().condition(ExitCondition.PROFIT_TARGET).threshold(0.5).build()))
                .build()).build();

        assertEquals(List.of(10, 20, 30, 40, 50, 1000),
                strategies.stream().map(ExitStrategy::getPriority).toList());
        assertInstanceOf(ExpirationExitStrategy.class, strategies.get(strategies.size() - 1));
        assertEquals("BollingerExit", strategies.get(3).getName());
    }
}
