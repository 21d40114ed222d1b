package com.samplepairs.pairing;

import java.util.List;

/**
 * Result of folding incoming pairs into the stored pairs.
 * @param merged full deduplicated collection, stored pairs first
 * @param added incoming pairs that were appended
 * @param collisions incoming pairs that were not appended, with the reason
 */
public record MergeResult(List<Pair> merged, List<Pair> added, List<PairCollision> collisions) {

    public MergeResult {
        merged = List.copyOf(merged);
        added = List.copyOf(added);
        collisions = List.copyOf(collisions);
    }
}
