package com.kura.search.client;

/**
 * Turns text into a fixed-dimension embedding vector. Implementations throw
 * {@link com.kura.search.error.BackendException} classified by failure kind.
 */
@FunctionalInterface
public interface EmbeddingProvider {
    float[] embed(String text);
}
