package com.kura.search.model;

public record VectorHit(String id, double distance) {
}
