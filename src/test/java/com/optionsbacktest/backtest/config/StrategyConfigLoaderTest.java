package com.optionsbacktest.backtest.config;

import com.optionsbacktest.backtest.engine.BacktestException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyConfigLoader.
 * Fixtures live under src/test/resources/strategies.
 */
class StrategyConfigLoaderTest {

    private StrategyConfigLoader loader;

    @BeforeEach
    void setUp() {
        StrategyConfigValidator validator = new StrategyConfigValidator(
                Validation.buildDefaultValidatorFactory().getValidator());
        loader = new StrategyConfigLoader(validator);
    }

    private StrategyConfig loadFixture(String name) {
        InputStream in = getClass().getResourceAsStream("/strategies/" + name);
        assertNotNull(in, "missing fixture " + name);
        return loader.load(in, name);
    }

    @Nested
    @DisplayName("Valid documents")
    class ValidDocumentTests {

        @Test
        @DisplayName("Should load every section of a complete YAML strategy")
        void shouldLoadCompleteStrategy() {
            StrategyConfig config = loadFixture("long-call.yml");

            assertEquals("long-call-momentum", config.getName());
            assertEquals("SPY", config.getUnderlying());
            assertEquals(OptionTypeBias.CALL, config.getOptionSelection().getType());
            assertEquals(0.40, config.getOptionSelection().getDelta().getTarget(), 1e-12);
            assertEquals(0.05, config.getOptionSelection().getDelta().getTolerance(), 1e-12);
            assertEquals(20, config.getOptionSelection().getDte().getMin());
            assertEquals(4, config.getExitRules().size());
            assertEquals(ExitCondition.INDICATOR_EXIT, config.getExitRules().get(2).getCondition());
            assertEquals(ExitRuleConfig.Indicator.RSI, config.getExitRules().get(2).getIndicator());
            assertEquals(100_000.0, config.getRisk().getInitialCapital(), 1e-9);
            assertEquals(3, config.getRisk().getMaxConcurrentPositions());
            assertTrue(config.hasMarketFilters());
            assertEquals(1, config.getMarketFilters().getOrGroups().size());
            assertEquals(2, config.getMarketFilters().getOrGroups().get(0).getMembers().size());
        }

        @Test
        @DisplayName("Should apply defaults for omitted optional fields")
        void shouldApplyDefaults() {
            StrategyConfig config = loader.parse("""
                    name: minimal
                    option_selection:
                      delta: {target: 0.5}
                      dte: {target: 30, min: 20, max: 40}
                    risk: {initial_capital: 5000, position_size_fraction: 0.1}
                    """);

            assertEquals("SPY", config.getUnderlying());
            assertEquals(OptionTypeBias.CALL, config.getOptionSelection().getType());
            assertEquals(100, config.getOptionSelection().getLiquidity().getMinVolume());
            assertEquals(0.65, config.getRisk().getCommissionPerContract(), 1e-12);
            assertEquals(1, config.getRisk().getMaxConcurrentPositions());
            assertTrue(config.getExitRules().isEmpty());
            assertFalse(config.hasMarketFilters());
        }

        @Test
        @DisplayName("Should accept JSON documents")
        void shouldAcceptJson() {
            StrategyConfig config = loader.parse("{\"name\": \"json\", "
                    + "\"option_selection\": {\"type\": \"put\", \"delta\": {\"target\": 0.3}, "
                    + "\"dte\": {\"target\": 10, \"min\": 5, \"max\": 15}}, "
                    + "\"risk\": {\"initial_capital\": 1000, \"position_size_fraction\": 0.2}}");

            assertEquals(OptionTypeBias.PUT, config.getOptionSelection().getType());
        }
    }

    @Nested
    @DisplayName("Rejected documents")
    class RejectedDocumentTests {

        @Test
        @DisplayName("Should reject unknown keys instead of ignoring them")
        void shouldRejectUnknownKey() {
            ConfigValidationException ex = assertThrows(ConfigValidationException.class,
                    () -> loadFixture("unknown-key.yml"));
            assertEquals(BacktestException.ErrorCode.CONFIG_VALIDATION, ex.getErrorCode());
            assertTrue(ex.getMessage().contains("treshold"));
        }

        @Test
        @DisplayName("Should report every cross-field violation in one exception")
        void shouldCollectAllViolations() {
            ConfigValidationException ex = assertThrows(ConfigValidationException.class,
                    () -> loadFixture("invalid-ranges.yml"));

            assertEquals(4, ex.getViolations().size());
            assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("dte: min (45) is greater than max (20)")));
            assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("target (0.3) is below min (0.4)")));
            assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("threshold must not exceed 1.0")));
            assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("max_days_held or dte_threshold")));
        }

        @Test
        @DisplayName("Should reject unknown enum codes")
        void shouldRejectUnknownCondition() {
            assertThrows(ConfigValidationException.class, () -> loader.parse("""
                    name: bad
                    option_selection:
                      delta: {target: 0.5}
                      dte: {target: 30, min: 20, max: 40}
                    exit_rules:
                      - condition: trailing_stop
                    risk: {initial_capital: 5000, position_size_fraction: 0.1}
                    """));
        }

        @Test
        @DisplayName("Should reject an empty document")
        void shouldRejectEmptyDocument() {
            assertThrows(ConfigValidationException.class, () -> loader.parse(""));
        }

        @Test
        @DisplayName("Should wrap unreadable files as CONFIG_LOAD_FAILED")
        void shouldFailOnMissingFile() {
            BacktestException ex = assertThrows(BacktestException.class,
                    () -> loader.load(Path.of("does", "not", "exist.yml")));
            assertEquals(BacktestException.ErrorCode.CONFIG_LOAD_FAILED, ex.getErrorCode());
        }
    }
}
