package com.kura.search.error;

import java.util.Locale;

public enum Backend {
    EMBEDDING,
    VECTOR,
    LEXICAL,
    METADATA;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
