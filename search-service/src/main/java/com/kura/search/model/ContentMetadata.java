package com.kura.search.model;

import java.time.Instant;
import java.util.List;

public record ContentMetadata(
        String id,
        String ownerId,
        String title,
        ContentType contentType,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt,
        String source,
        String annotation,
        String excerptSource
) {
    public ContentMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
