package com.kura.search.config;

public enum SearchMode {
    /** Always query both backends. */
    COMBINED,
    /** Query lexical only when the vector path is unavailable or short of candidates. */
    FALLBACK
}
