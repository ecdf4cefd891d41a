package com.delta.searchsync.sync.model;

import java.time.Instant;

public record Article(
    long id,
    String title,
    String body,
    String author,
    Instant publishedAt,
    Instant updatedAt
) {
}
