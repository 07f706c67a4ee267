package com.kura.search.client;

import com.kura.search.model.LexicalHit;

import java.util.List;

/**
 * Owner-scoped keyword search. Ranks are engine specific and only comparable
 * within one response.
 */
public interface LexicalIndex {

    List<LexicalHit> query(String text, int k, String ownerId);

    default RankOrder rankOrder() {
        return RankOrder.HIGHER_IS_BETTER;
    }
}
