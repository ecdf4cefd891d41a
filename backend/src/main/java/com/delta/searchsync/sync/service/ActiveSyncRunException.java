package com.delta.searchsync.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveSyncRunException extends RuntimeException {
    public ActiveSyncRunException(String message) {
        super(message);
    }
}
