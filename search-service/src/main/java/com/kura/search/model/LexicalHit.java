package com.kura.search.model;

public record LexicalHit(String id, double rank) {
}
