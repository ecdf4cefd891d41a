package com.delta.searchsync.sync.model;

import java.util.Map;

public record IndexedDocument(String id, Map<String, Object> source) {
}
