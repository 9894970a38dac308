package com.optionsbacktest.backtest.engine;

import java.time.LocalDate;
import java.util.Locale;

/**
 * One structured audit line.
 *
 * @param contract contract identity, or {@code null} when the event is not about a contract
 * @param price    price the event happened at, or {@code null}
 */
public record AuditEntry(
        long sequence,
        LocalDate date,
        AuditEventType type,
        String contract,
        Double price,
        String rationale
) {

    /**
     * {@code date | EVENT | contract | price | rationale}, with "-" for absent fields.
     */
    public String format() {
        return date + " | " + type + " | " + (contract != null ? contract : "-") + " | "
                + (price != null ? String.format(Locale.ROOT, "%.4f", price) : "-") + " | " + rationale;
    }
}
