package com.optionsbacktest.backtest.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only audit trail of a single run.
 * <p>
 * Every entry, exit, skipped entry, filter decision, stale mark, data gap, quote anomaly and
 * daily equity point produces one line. Entries are also echoed to the application log.
 */
@Slf4j
public class AuditLog {

    private final List<AuditEntry> entries = new ArrayList<>();

    public AuditEntry record(LocalDate date, AuditEventType type, String contract, Double price, String rationale) {
        AuditEntry entry = new AuditEntry(entries.size() + 1L, date, type, contract, price, rationale);
        entries.add(entry);
        switch (type) {
            case DATA_GAP, MARK_STALE, QUOTE_ANOMALY -> log.warn(entry.format());
            case ENTRY, EXIT, RUN_START, RUN_END -> log.info(entry.format());
            default -> log.debug(entry.format());
        }
        return entry;
    }

    public AuditEntry record(LocalDate date, AuditEventType type, String rationale) {
        return record(date, type, null, null, rationale);
    }

    public List<AuditEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<AuditEntry> entries(AuditEventType type) {
        return entries.stream().filter(e -> e.type() == type).toList();
    }

    public List<String> lines() {
        return entries.stream().map(AuditEntry::format).toList();
    }

    public int size() {
        return entries.size();
    }
}
