package com.kura.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which retrieval path produced a candidate.
 */
public enum SourceMethod {
    VECTOR,
    LEXICAL,
    COMBINED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
