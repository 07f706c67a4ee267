package com.kura.search.service;

import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ScoredResult;

import java.util.List;
import java.util.Map;

/**
 * One round of fused candidates together with the filter attributes of every
 * candidate that still exists in the metadata store.
 *
 * @param truncated true when a backend returned as many hits as requested, so
 *                  more matches may exist beyond this pool
 */
public record CandidatePool(
        List<ScoredResult> candidates,
        Map<String, ContentAttributes> attributes,
        boolean truncated
) {
    public CandidatePool {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static CandidatePool empty() {
        return new CandidatePool(List.of(), Map.of(), false);
    }
}
