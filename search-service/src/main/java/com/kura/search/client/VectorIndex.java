package com.kura.search.client;

import com.kura.search.model.VectorHit;

import java.util.List;

/**
 * Owner-scoped nearest-neighbour lookup. Hits come back nearest first with
 * their cosine distance.
 */
@FunctionalInterface
public interface VectorIndex {
    List<VectorHit> query(float[] vector, int k, String ownerId);
}
