package com.kura.search.service;

import com.kura.search.model.ScoredResult;

import java.util.List;

public record FilterOutcome(List<ScoredResult> results, int wideningRounds) {
    public FilterOutcome {
        results = List.copyOf(results);
    }
}
