package com.optionsbacktest.backtest.exit;

import lombok.Getter;

/**
 * Result holder for exit strategy evaluation.
 * <p>
 * Represents the outcome of an {@link ExitStrategy#evaluate(ExitContext)} call: either
 * no exit, or an exit carrying its reason and a formatted detail line for the audit log.
 */
@Getter
public final class ExitResult {

    /** Pre-allocated singleton for the common no-exit case */
    public static final ExitResult NO_EXIT_RESULT = new ExitResult(null, null);

    /** Reason of the exit, {@code null} when no exit */
    private final ExitReason reason;

    /** Exit detail string (formatted by strategy) */
    private final String detail;

    private ExitResult(ExitReason reason, String detail) {
        this.reason = reason;
        this.detail = detail;
    }

    /**
     * Factory method for NO_EXIT result (uses pre-allocated singleton).
     *
     * @return singleton NO_EXIT result
     */
    public static ExitResult noExit() {
        return NO_EXIT_RESULT;
    }

    /**
     * Factory method for an exit.
     *
     * @param reason why the position closes
     * @param detail formatted explanation
     * @return new exit result
     */
    public static ExitResult exit(ExitReason reason, String detail) {
        if (reason == null) {
            throw new IllegalArgumentException("Exit reason is required");
        }
        return new ExitResult(reason, detail);
    }

    /**
     * @return true if the position must be closed
     */
    public boolean requiresAction() {
        return reason != null;
    }

    @Override
    public String toString() {
        return requiresAction() ? reason.getCode() + " [" + detail + "]" : "no_exit";
    }
}
