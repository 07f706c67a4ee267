package com.kura.search.model;

public record ScoredResult(String id, double relevanceScore, SourceMethod sourceMethod) {
}
