package com.delta.searchsync.sync.index;

public class SearchIndexException extends RuntimeException {
    private final int statusCode;

    public SearchIndexException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SearchIndexException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
