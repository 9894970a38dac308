package com.optionsbacktest.backtest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Optional regime and technical gates for new entries.
 * <p>
 * Each sub-filter is enabled by being present. Enabled filters are combined with AND,
 * except that the members of an {@link OrGroup} are combined with OR and the group as a
 * whole contributes a single AND term.
 */
@Value
@Builder
@Jacksonized
public class MarketFilterConfig {

    @Valid
    TrendFilter trend;

    @Valid
    VolatilityRegimeFilter volatilityRegime;

    @Valid
    RsiFilter rsi;

    @Valid
    BollingerFilter bollinger;

    @Valid
    @Builder.Default
    List<OrGroup> orGroups = List.of();

    public boolean isConfigured(FilterName name) {
        return switch (name) {
            case TREND -> trend != null;
            case VOLATILITY_REGIME -> volatilityRegime != null;
            case RSI -> rsi != null;
            case BOLLINGER -> bollinger != null;
        };
    }

    public boolean isEmpty() {
        return trend == null && volatilityRegime == null && rsi == null && bollinger == null;
    }

    // ==================== SUB-FILTERS ====================

    /** Price relative to its simple moving average. */
    @Value
    @Builder
    @Jacksonized
    public static class TrendFilter {
        @Min(1)
        @Builder.Default
        int maPeriod = 20;

        @Builder.Default
        boolean requireAboveMa = true;
    }

    /**
     * Buckets today's volatility as low, normal or high against its own recent history.
     */
    @Value
    @Builder
    @Jacksonized
    public static class VolatilityRegimeFilter {
        @NotNull
        @Builder.Default
        VolatilitySource source = VolatilitySource.IMPLIED;

        @NotNull
        @Builder.Default
        RegimeMethod method = RegimeMethod.PERCENTILE;

        /** Prior observations the current value is ranked against. */
        @Min(2)
        @Builder.Default
        int lookbackDays = 20;

        /** Return window used for realized volatility. */
        @Min(2)
        @Builder.Default
        int realizedWindow = 20;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        @Builder.Default
        double lowPercentile = 25.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        @Builder.Default
        double highPercentile = 75.0;

        /** EWMA smoothing factor. */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        @Builder.Default
        double ewmaAlpha = 0.2;

        /** Relative band around the EWMA that counts as normal (0.15 = +/-15%). */
        @DecimalMin("0.0")
        @Builder.Default
        double ewmaBand = 0.15;

        @NotEmpty
        @Builder.Default
        Set<VolatilityRegime> allowedRegimes = EnumSet.allOf(VolatilityRegime.class);

        @DecimalMin("0.0")
        Double minIv;

        @DecimalMin("0.0")
        Double maxIv;
    }

    /** Momentum oscillator gate: calls need oversold, puts need overbought. */
    @Value
    @Builder
    @Jacksonized
    public static class RsiFilter {
        @Min(2)
        @Builder.Default
        int period = 14;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        @Builder.Default
        double oversold = 30.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        @Builder.Default
        double overbought = 70.0;
    }

    /** Mean-reversion gate on the position of price inside its Bollinger bands. */
    @Value
    @Builder
    @Jacksonized
    public static class BollingerFilter {
        @Min(2)
        @Builder.Default
        int period = 20;

        @DecimalMin(value = "0.0", inclusive = false)
        @Builder.Default
        double stdDev = 2.0;

        @Builder.Default
        double lowerBandThreshold = 0.2;

        @Builder.Default
        double upperBandThreshold = 0.8;
    }

    /** Named set of sub-filters of which at least one must pass. */
    @Value
    @Builder
    @Jacksonized
    public static class OrGroup {
        @NotBlank
        String name;

        @NotEmpty
        List<FilterName> members;
    }

    // ==================== ENUMS ====================

    public enum FilterName {
        TREND("trend"),
        VOLATILITY_REGIME("volatility_regime"),
        RSI("rsi"),
        BOLLINGER("bollinger");

        private final String code;

        FilterName(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static FilterName fromCode(String value) {
            for (FilterName name : values()) {
                if (name.code.equalsIgnoreCase(value)) {
                    return name;
                }
            }
            throw new IllegalArgumentException("Unknown market filter: " + value);
        }
    }

    public enum VolatilitySource {
        IMPLIED("implied"),
        REALIZED("realized");

        private final String code;

        VolatilitySource(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static VolatilitySource fromCode(String value) {
            for (VolatilitySource source : values()) {
                if (source.code.equalsIgnoreCase(value)) {
                    return source;
                }
            }
            throw new IllegalArgumentException("Unknown volatility source: " + value);
        }
    }

    public enum RegimeMethod {
        PERCENTILE("percentile"),
        EWMA("ewma");

        private final String code;

        RegimeMethod(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static RegimeMethod fromCode(String value) {
            for (RegimeMethod method : values()) {
                if (method.code.equalsIgnoreCase(value)) {
                    return method;
                }
            }
            throw new IllegalArgumentException("Unknown regime method: " + value);
        }
    }

    public enum VolatilityRegime {
        LOW("low"),
        NORMAL("normal"),
        HIGH("high");

        private final String code;

        VolatilityRegime(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static VolatilityRegime fromCode(String value) {
            for (VolatilityRegime regime : values()) {
                if (regime.code.equalsIgnoreCase(value)) {
                    return regime;
                }
            }
            throw new IllegalArgumentException("Unknown volatility regime: " + value);
        }
    }
}
