package com.kura.search.model;

import java.time.Instant;
import java.util.List;

public record SearchResult(
        String id,
        String title,
        String excerpt,
        ContentType contentType,
        double relevanceScore,
        SourceMethod sourceMethod,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt,
        String ownerId
) {
    public SearchResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
