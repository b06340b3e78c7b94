package com.bmsedge.production.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Setter
@Getter
public class CommitResult {
    private LocalDate targetDate;
    private int rowsWritten;
    private int machinesUpdated;
    private int batches;

    public CommitResult() {}

    public CommitResult(LocalDate targetDate, int rowsWritten, int machinesUpdated, int batches) {
        this.targetDate = targetDate;
        this.rowsWritten = rowsWritten;
        this.machinesUpdated = machinesUpdated;
        this.batches = batches;
    }
}
