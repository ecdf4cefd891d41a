package com.delta.searchsync.sync.model;

import java.util.List;
import java.util.Locale;

public record DeployRequest(List<String> indices, Boolean onlyImport) {
    public List<String> normalizedIndices() {
        if (indices == null) {
            return List.of();
        }
        return indices.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(value -> value.trim().toLowerCase(Locale.ROOT))
            .distinct()
            .toList();
    }

    public boolean isOnlyImport() {
        return onlyImport != null && onlyImport;
    }
}
