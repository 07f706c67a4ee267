package com.kura.search.model;

/**
 * A backend hit before normalisation; {@code rawScore} is on the native scale
 * of its source.
 */
public record RawHit(String id, double rawScore, SourceMethod sourceMethod) {
}
