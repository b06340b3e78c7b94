package com.bmsedge.production.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Read-only view of a machine and its log history, taken once at the start
 * of an import session. Logs are held in ascending date order, one per date.
 */
@Getter
public class MachineSnapshot {

    private final Long id;
    private final String name;
    private final Integer machineNumber;
    private final String machineType;
    private final List<String> workCenterAliases;
    private final List<DailyLog> logs;

    public MachineSnapshot(Long id, String name, Integer machineNumber, String machineType,
                           List<String> workCenterAliases, List<DailyLog> logs) {
        this.id = id;
        this.name = name != null ? name : "";
        this.machineNumber = machineNumber;
        this.machineType = machineType;
        this.workCenterAliases = workCenterAliases != null
                ? List.copyOf(workCenterAliases) : Collections.emptyList();
        List<DailyLog> sorted = new ArrayList<>(logs != null ? logs : Collections.emptyList());
        sorted.sort(Comparator.comparing(DailyLog::getDate));
        this.logs = Collections.unmodifiableList(sorted);
    }

    /**
     * The log with the greatest date strictly before {@code date}.
     */
    public Optional<DailyLog> findPreviousLog(LocalDate date) {
        DailyLog previous = null;
        for (DailyLog log : logs) {
            if (!log.getDate().isBefore(date)) {
                break;
            }
            previous = log;
        }
        return Optional.ofNullable(previous);
    }

    public Optional<DailyLog> findLog(LocalDate date) {
        return logs.stream().filter(log -> log.getDate().equals(date)).findFirst();
    }

    public boolean hasLogOn(LocalDate date) {
        return findLog(date).isPresent();
    }
}
