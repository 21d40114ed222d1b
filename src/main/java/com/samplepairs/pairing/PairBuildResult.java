package com.samplepairs.pairing;

import java.util.List;

/**
 * Pairs produced by {@link PairBuilder} plus the positions that ended up in no pair.
 */
public record PairBuildResult(List<Pair> pairs, List<Integer> leftoverPositions) {

    public PairBuildResult {
        pairs = List.copyOf(pairs);
        leftoverPositions = List.copyOf(leftoverPositions);
    }

    public boolean hasLeftovers() {
        return !leftoverPositions.isEmpty();
    }
}
