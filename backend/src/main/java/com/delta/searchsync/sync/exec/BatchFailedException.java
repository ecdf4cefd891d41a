package com.delta.searchsync.sync.exec;

public class BatchFailedException extends RuntimeException {
    private final int failedUnits;
    private final int totalUnits;

    public BatchFailedException(int failedUnits, int totalUnits, Throwable cause) {
        super(failedUnits + " of " + totalUnits + " work units failed: " + cause.getMessage(), cause);
        this.failedUnits = failedUnits;
        this.totalUnits = totalUnits;
    }

    public int getFailedUnits() {
        return failedUnits;
    }

    public int getTotalUnits() {
        return totalUnits;
    }
}
