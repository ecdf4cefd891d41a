package com.delta.searchsync.sync.model;

public record IndexHit(String id) {
}
