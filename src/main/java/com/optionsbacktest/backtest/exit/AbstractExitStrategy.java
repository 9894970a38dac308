package com.optionsbacktest.backtest.exit;

/**
 * Base class for exit strategies.
 * <p>
 * Provides exit detail building and fixed two-decimal formatting. The builders are
 * ThreadLocal because the same strategy classes run in parallel parameter sweeps.
 */
public abstract class AbstractExitStrategy implements ExitStrategy {

    protected static final ThreadLocal<StringBuilder> EXIT_REASON_BUILDER =
        ThreadLocal.withInitial(() -> new StringBuilder(96));

    private static final ThreadLocal<StringBuilder> FORMAT_DOUBLE_BUILDER =
        ThreadLocal.withInitial(() -> new StringBuilder(16));

    /**
     * Locale-independent double formatting.
     *
     * @param value the double value to format
     * @return string representation with 2 decimal places (e.g., "3.14", "-2.50")
     */
    protected static String formatDouble(double value) {
        StringBuilder sb = FORMAT_DOUBLE_BUILDER.get();
        sb.setLength(0);
        appendDouble(sb, value);
        return sb.toString();
    }

    /**
     * Append double with 2 decimal places to StringBuilder.
     *
     * @param sb StringBuilder to append to
     * @param value double value to format and append
     */
    protected static void appendDouble(StringBuilder sb, double value) {
        long scaled = Math.round(value * 100);
        if (scaled < 0) {
            sb.append('-');
            scaled = -scaled;
        }
        sb.append(scaled / 100);
        sb.append('.');
        long frac = scaled % 100;
        if (frac < 10) sb.append('0');
        sb.append(frac);
    }

    /**
     * Percent with 2 decimals from a fraction (0.5 becomes "50.00%").
     */
    protected static void appendPercent(StringBuilder sb, double fraction) {
        appendDouble(sb, fraction * 100.0);
        sb.append('%');
    }

    /**
     * Get a cleared StringBuilder for building exit details.
     *
     * @return ThreadLocal StringBuilder with length reset to 0
     */
    protected static StringBuilder getExitReasonBuilder() {
        StringBuilder sb = EXIT_REASON_BUILDER.get();
        sb.setLength(0);
        return sb;
    }
}
