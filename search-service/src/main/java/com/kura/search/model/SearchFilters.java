package com.kura.search.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structural restrictions applied on top of relevance ranking. Empty sets and
 * null bounds mean "no restriction".
 */
public record SearchFilters(
        Set<ContentType> contentTypes,
        Set<String> tags,
        Instant dateFrom,
        Instant dateTo
) {
    private static final SearchFilters NONE = new SearchFilters(null, null, null, null);

    public SearchFilters {
        contentTypes = contentTypes == null || contentTypes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(contentTypes));
        tags = tags == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    public static SearchFilters none() {
        return NONE;
    }

    public boolean isEmpty() {
        return contentTypes.isEmpty() && tags.isEmpty() && dateFrom == null && dateTo == null;
    }
}
