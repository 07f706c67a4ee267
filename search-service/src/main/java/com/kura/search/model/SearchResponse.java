package com.kura.search.model;

import java.time.Instant;
import java.util.List;

public record SearchResponse(
        List<SearchResult> results,
        int totalResults,
        SearchMethod searchMethodUsed,
        SearchFilters appliedFilters,
        String query,
        Instant timestamp
) {
    public SearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
