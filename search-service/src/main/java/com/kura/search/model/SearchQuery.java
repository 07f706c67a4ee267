package com.kura.search.model;

/**
 * A single search request as seen by the orchestrator. {@code limit} may be
 * null, in which case the configured default applies.
 */
public record SearchQuery(String query, Integer limit, SearchFilters filters, String ownerId) {

    public SearchQuery {
        filters = filters == null ? SearchFilters.none() : filters;
    }

    public static SearchQuery of(String query, String ownerId) {
        return new SearchQuery(query, null, SearchFilters.none(), ownerId);
    }
}
