package com.samplepairs.app;

import com.samplepairs.pairing.Pair;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage for the canonical pair collection.
 * <p>
 * Implementations are not required to lock: a merge reads the store once and rewrites it once, and
 * concurrent merges on the same store must be serialized by the caller.
 */
public interface PairStoreInterface {
    /**
     * Loads every stored pair in stored order.
     * @return stored pairs, empty if the store does not exist yet
     * @throws IOException if the store exists but cannot be read or parsed
     */
    List<Pair> load() throws IOException;

    /**
     * Replaces the stored collection. Readers never observe a partially written store.
     * @param pairs pairs to persist
     * @throws IOException if writing fails
     */
    void save(List<Pair> pairs) throws IOException;
}
