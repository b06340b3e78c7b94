package com.bmsedge.production.model;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory state of one daily import run. Machines and mappings are read once
 * when the session starts and are not re-read while it is open.
 */
@Getter
@Setter
public class ImportSession {

    private final String id;
    private final LocalDate targetDate;
    private final String fileName;
    private final LocalDateTime createdAt;
    private LocalDateTime lastActivityAt;

    private ImportSessionStage stage = ImportSessionStage.MAPPING_REVIEW;

    private final List<ImportRow> rows;
    private final int skippedRows;
    private final List<MachineSnapshot> machines;
    private final Map<String, Long> mappings;

    private List<WorkCenterProposal> workCenters = new ArrayList<>();
    private List<FabricProposal> missingFabrics = new ArrayList<>();
    private List<StagedReconciliationRow> stagedRows = new ArrayList<>();

    public ImportSession(LocalDate targetDate, String fileName, List<ImportRow> rows, int skippedRows,
                         List<MachineSnapshot> machines, Map<String, Long> mappings) {
        this.id = UUID.randomUUID().toString();
        this.targetDate = targetDate;
        this.fileName = fileName;
        this.createdAt = LocalDateTime.now();
        this.lastActivityAt = createdAt;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.skippedRows = skippedRows;
        this.machines = Collections.unmodifiableList(new ArrayList<>(machines));
        this.mappings = new LinkedHashMap<>(mappings);
    }

    public void touch() {
        lastActivityAt = LocalDateTime.now();
    }

    public boolean isExpired(LocalDateTime now, long timeoutMinutes) {
        return lastActivityAt.plusMinutes(timeoutMinutes).isBefore(now);
    }

    public Optional<StagedReconciliationRow> findStagedRow(Long machineId) {
        return stagedRows.stream()
                .filter(row -> row.getMachineId().equals(machineId))
                .findFirst();
    }

    public Optional<MachineSnapshot> findMachine(Long machineId) {
        return machines.stream()
                .filter(machine -> machine.getId().equals(machineId))
                .findFirst();
    }
}
