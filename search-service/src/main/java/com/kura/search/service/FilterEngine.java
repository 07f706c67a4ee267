package com.kura.search.service;

import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ScoredResult;
import com.kura.search.model.SearchFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies structural filters to ranked candidates without reordering them.
 * When filtering leaves fewer than {@code limit} results out of a truncated
 * pool, the pool is widened a bounded number of times.
 */
public class FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    private final int maxWideningRounds;

    public FilterEngine(int maxWideningRounds) {
        this.maxWideningRounds = Math.max(0, maxWideningRounds);
    }

    public FilterOutcome filter(
            CandidatePool initialPool,
            SearchFilters filters,
            String ownerId,
            int limit,
            PoolWidener widener
    ) {
        SearchFilters effective = filters == null ? SearchFilters.none() : filters;
        CandidatePool pool = initialPool == null ? CandidatePool.empty() : initialPool;
        Map<String, ContentAttributes> attributes = new HashMap<>(pool.attributes());
        Set<String> seenIds = new LinkedHashSet<>();
        pool.candidates().forEach(c -> seenIds.add(c.id()));

        List<ScoredResult> passed = apply(pool.candidates(), attributes, effective, ownerId);
        int rounds = 0;
        while (passed.size() < limit && pool.truncated() && widener != null && rounds < maxWideningRounds) {
            CandidatePool widened = widener.widen(rounds + 1, Set.copyOf(seenIds));
            if (widened == null) {
                break;
            }
            rounds++;
            attributes.putAll(widened.attributes());
            int before = seenIds.size();
            widened.candidates().forEach(c -> seenIds.add(c.id()));
            int added = seenIds.size() - before;
            List<ScoredResult> widenedPassed = apply(widened.candidates(), attributes, effective, ownerId);
            if (widenedPassed.size() < passed.size()) {
                log.warn(
                        "event=filter_widening_shrank round={} passed={} previous={}",
                        rounds,
                        widenedPassed.size(),
                        passed.size()
                );
                break;
            }
            pool = widened;
            passed = widenedPassed;
            log.debug(
                    "event=filter_widened round={} pool_size={} new_candidates={} passed={} limit={}",
                    rounds,
                    pool.candidates().size(),
                    added,
                    passed.size(),
                    limit
            );
            if (added == 0) {
                break;
            }
        }

        if (passed.size() < limit && pool.truncated() && rounds >= maxWideningRounds && maxWideningRounds > 0) {
            log.info("event=filter_widening_exhausted rounds={} passed={} limit={}", rounds, passed.size(), limit);
        }

        List<ScoredResult> limited = passed.size() <= limit ? passed : new ArrayList<>(passed.subList(0, limit));
        return new FilterOutcome(limited, rounds);
    }

    private List<ScoredResult> apply(
            List<ScoredResult> candidates,
            Map<String, ContentAttributes> attributes,
            SearchFilters filters,
            String ownerId
    ) {
        List<ScoredResult> passed = new ArrayList<>(candidates.size());
        for (ScoredResult candidate : candidates) {
            ContentAttributes attrs = attributes.get(candidate.id());
            if (attrs == null) {
                log.warn("event=candidate_without_metadata id={}", candidate.id());
                continue;
            }
            if (!Objects.equals(attrs.ownerId(), ownerId)) {
                log.warn("event=foreign_candidate_dropped id={} owner_id={}", candidate.id(), ownerId);
                continue;
            }
            if (matches(attrs, filters)) {
                passed.add(candidate);
            }
        }
        return passed;
    }

    static boolean matches(ContentAttributes attrs, SearchFilters filters) {
        if (!filters.contentTypes().isEmpty() && !filters.contentTypes().contains(attrs.contentType())) {
            return false;
        }
        if (!filters.tags().isEmpty() && !attrs.tags().containsAll(filters.tags())) {
            return false;
        }
        Instant createdAt = attrs.createdAt();
        if (filters.dateFrom() != null && (createdAt == null || createdAt.isBefore(filters.dateFrom()))) {
            return false;
        }
        return filters.dateTo() == null || (createdAt != null && !createdAt.isAfter(filters.dateTo()));
    }
}
