package com.delta.searchsync.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownIndexException extends RuntimeException {
    public UnknownIndexException(String indexName) {
        super("No import source registered for index " + indexName);
    }
}
