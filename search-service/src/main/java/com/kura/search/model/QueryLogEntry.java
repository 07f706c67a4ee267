package com.kura.search.model;

import java.time.Instant;

public record QueryLogEntry(
        String query,
        int resultCount,
        SearchMethod method,
        double elapsedMs,
        String ownerId,
        String outcome,
        Instant loggedAt
) {
}
