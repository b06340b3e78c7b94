package com.bmsedge.production.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Group of log writes committed atomically. A write's operations never span batches.
 */
public class WriteBatch {

    private final List<LogWrite> writes;

    public WriteBatch(List<LogWrite> writes) {
        this.writes = Collections.unmodifiableList(new ArrayList<>(writes));
    }

    public List<LogWrite> getWrites() {
        return writes;
    }

    public int operationCount() {
        return writes.size() * LogWrite.OPERATIONS;
    }

    public static List<WriteBatch> partition(List<LogWrite> writes, int maxOperations) {
        int writesPerBatch = maxOperations / LogWrite.OPERATIONS;
        if (writesPerBatch < 1) {
            throw new IllegalArgumentException("Batch ceiling of " + maxOperations
                    + " operations cannot hold a single log write");
        }

        List<WriteBatch> batches = new ArrayList<>();
        for (int start = 0; start < writes.size(); start += writesPerBatch) {
            int end = Math.min(start + writesPerBatch, writes.size());
            batches.add(new WriteBatch(writes.subList(start, end)));
        }
        return batches;
    }
}
