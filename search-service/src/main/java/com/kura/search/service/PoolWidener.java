package com.kura.search.service;

import java.util.Set;

/**
 * Re-queries the backends with a larger candidate pool.
 */
@FunctionalInterface
public interface PoolWidener {

    /**
     * @param round      1-based widening round
     * @param excludeIds candidate ids already evaluated; their attributes need not be fetched again
     * @return the widened pool, or null when no larger pool can be produced
     */
    CandidatePool widen(int round, Set<String> excludeIds);
}
