package com.kura.search.client;

public enum RankOrder {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER
}
