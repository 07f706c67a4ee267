package com.kura.search.model;

import java.time.Instant;
import java.util.List;

/**
 * The subset of stored metadata needed to filter and tie-break candidates.
 */
public record ContentAttributes(
        String id,
        String ownerId,
        ContentType contentType,
        List<String> tags,
        Instant createdAt
) {
    public ContentAttributes {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
