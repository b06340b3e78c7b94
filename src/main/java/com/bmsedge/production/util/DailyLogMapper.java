package com.bmsedge.production.util;

import com.bmsedge.production.model.DailyLog;
import com.bmsedge.production.model.DailyLogEntry;
import com.bmsedge.production.model.MachineDailyLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between {@link DailyLog} and its stored forms. Stored logs carry the
 * remaining quantity under both the legacy {@code remaining} and the canonical
 * {@code remainingMfg} columns; the canonical one wins when both are present.
 */
public final class DailyLogMapper {

    private DailyLogMapper() {}

    public static DailyLog fromEntry(DailyLogEntry entry) {
        return new DailyLog(
                entry.getLogDate(),
                entry.getStatus(),
                entry.getFabric(),
                entry.getClient(),
                entry.getDayProduction(),
                entry.getScrap(),
                remainingOf(entry.getRemainingMfg(), entry.getRemaining()),
                entry.getReason()
        );
    }

    public static DailyLog fromRecord(MachineDailyLog record) {
        return new DailyLog(
                record.getLogDate(),
                record.getStatus(),
                record.getFabric(),
                record.getClient(),
                record.getDayProduction(),
                record.getScrap(),
                remainingOf(record.getRemainingMfg(), record.getRemaining()),
                record.getReason()
        );
    }

    /**
     * One machine's history in date order. A per-date record replaces the embedded entry for the same date.
     */
    public static List<DailyLog> mergeHistory(Collection<DailyLogEntry> entries, Collection<MachineDailyLog> records) {
        Map<LocalDate, DailyLog> byDate = new TreeMap<>();
        entries.forEach(entry -> byDate.put(entry.getLogDate(), fromEntry(entry)));
        records.forEach(record -> byDate.put(record.getLogDate(), fromRecord(record)));
        return new ArrayList<>(byDate.values());
    }

    public static DailyLogEntry toEntry(DailyLog log) {
        DailyLogEntry entry = new DailyLogEntry();
        entry.setLogDate(log.getDate());
        entry.setStatus(log.getStatus());
        entry.setFabric(log.getFabric());
        entry.setClient(log.getClient());
        entry.setDayProduction(log.getDayProduction());
        entry.setScrap(log.getScrap());
        entry.setRemaining(log.getRemainingMfg());
        entry.setRemainingMfg(log.getRemainingMfg());
        entry.setReason(log.getReason());
        return entry;
    }

    /**
     * Copies the log onto an existing or new per-date record.
     */
    public static void applyToRecord(DailyLog log, MachineDailyLog record) {
        record.setLogDate(log.getDate());
        record.setStatus(log.getStatus());
        record.setFabric(log.getFabric());
        record.setClient(log.getClient());
        record.setDayProduction(log.getDayProduction());
        record.setScrap(log.getScrap());
        record.setRemaining(log.getRemainingMfg());
        record.setRemainingMfg(log.getRemainingMfg());
        record.setReason(log.getReason());
    }

    private static BigDecimal remainingOf(BigDecimal remainingMfg, BigDecimal legacyRemaining) {
        if (remainingMfg != null) {
            return DailyLog.nonNegative(remainingMfg);
        }
        return DailyLog.nonNegative(legacyRemaining);
    }
}
