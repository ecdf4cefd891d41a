package com.delta.searchsync.sync.exec;

public class SchedulerSaturatedException extends RuntimeException {
    public SchedulerSaturatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
