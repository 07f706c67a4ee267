package com.kura.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SearchMethod {
    VECTOR("vector"),
    FTS("fts"),
    COMBINED("combined");

    private final String label;

    SearchMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static SearchMethod of(boolean vectorContributed, boolean lexicalContributed) {
        if (vectorContributed && lexicalContributed) {
            return COMBINED;
        }
        return vectorContributed ? VECTOR : FTS;
    }
}
