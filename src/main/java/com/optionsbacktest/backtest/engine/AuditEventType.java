package com.optionsbacktest.backtest.engine;

/**
 * Kinds of audit log lines. The recoverable run conditions (data gaps, missing contracts,
 * insufficient capital, stale quotes, quote anomalies) are recorded here instead of thrown.
 */
public enum AuditEventType {
    RUN_START,
    DATA_GAP,
    MARK_STALE,
    QUOTE_ANOMALY,
    FILTER,
    ENTRY,
    ENTRY_SKIPPED,
    EXIT,
    EQUITY,
    RUN_END
}
