package com.kura.search.service;

import com.kura.search.config.LimitPolicy;
import com.kura.search.config.SearchProperties;
import com.kura.search.error.ValidationException;
import com.kura.search.model.SearchFilters;
import com.kura.search.model.SearchQuery;

/**
 * Synchronous input checks that run before any external call.
 */
public class QueryValidator {

    private final int maxQueryLength;
    private final int defaultLimit;
    private final LimitPolicy limitPolicy;

    public QueryValidator(SearchProperties properties) {
        this(properties.getMaxQueryLength(), properties.getDefaultLimit(), properties.getLimitPolicy());
    }

    public QueryValidator(int maxQueryLength, int defaultLimit, LimitPolicy limitPolicy) {
        this.maxQueryLength = Math.max(1, maxQueryLength);
        this.defaultLimit = Math.min(SearchProperties.MAX_LIMIT, Math.max(SearchProperties.MIN_LIMIT, defaultLimit));
        this.limitPolicy = limitPolicy == null ? LimitPolicy.REJECT : limitPolicy;
    }

    /**
     * @return the query with its text trimmed and its limit resolved
     * @throws ValidationException when the request can never be served
     */
    public SearchQuery validate(SearchQuery query) {
        if (query == null) {
            throw new ValidationException("Search request is required");
        }
        String text = query.query() == null ? "" : query.query().trim();
        if (text.isEmpty()) {
            throw new ValidationException("Search query cannot be empty");
        }
        if (text.length() > maxQueryLength) {
            throw new ValidationException("Search query must be at most " + maxQueryLength + " characters");
        }
        if (query.ownerId() == null || query.ownerId().isBlank()) {
            throw new ValidationException("Owner id is required");
        }
        SearchFilters filters = query.filters();
        if (filters.dateFrom() != null && filters.dateTo() != null && filters.dateFrom().isAfter(filters.dateTo())) {
            throw new ValidationException("dateFrom must not be after dateTo");
        }
        for (String tag : filters.tags()) {
            if (tag == null || tag.isBlank()) {
                throw new ValidationException("Tag filters must not be blank");
            }
        }
        return new SearchQuery(text, resolveLimit(query.limit()), filters, query.ownerId());
    }

    private int resolveLimit(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        int limit = requested;
        if (limit >= SearchProperties.MIN_LIMIT && limit <= SearchProperties.MAX_LIMIT) {
            return limit;
        }
        if (limitPolicy == LimitPolicy.CLAMP) {
            return Math.min(SearchProperties.MAX_LIMIT, Math.max(SearchProperties.MIN_LIMIT, limit));
        }
        throw new ValidationException(
                "Limit must be a number between " + SearchProperties.MIN_LIMIT + " and " + SearchProperties.MAX_LIMIT
        );
    }
}
