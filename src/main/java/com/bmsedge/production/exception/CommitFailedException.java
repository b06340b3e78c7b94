package com.bmsedge.production.exception;

/**
 * A store write failed part way through a commit. Batches committed before the
 * failure are not rolled back.
 */
public class CommitFailedException extends RuntimeException {

    private final int committedBatches;
    private final int totalBatches;
    private final int machinesCommitted;

    public CommitFailedException(int committedBatches, int totalBatches, int machinesCommitted, Throwable cause) {
        super(String.format(
                "Commit failed at batch %d of %d. %d batch(es) covering %d machine(s) were already saved and "
                        + "are not rolled back. Re-run the import to see the current state before retrying.",
                committedBatches + 1, totalBatches, committedBatches, machinesCommitted), cause);
        this.committedBatches = committedBatches;
        this.totalBatches = totalBatches;
        this.machinesCommitted = machinesCommitted;
    }

    public int getCommittedBatches() {
        return committedBatches;
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    public int getMachinesCommitted() {
        return machinesCommitted;
    }
}
