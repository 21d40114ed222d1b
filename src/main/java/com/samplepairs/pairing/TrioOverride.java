package com.samplepairs.pairing;

import java.util.List;

/**
 * One original sampled by two tracks. Produces two pairs sharing the original.
 */
public record TrioOverride(int original, int sampleA, int sampleB) {

    /**
     * Positions in declaration order: original, sampleA, sampleB.
     */
    public List<Integer> positions() {
        return List.of(original, sampleA, sampleB);
    }
}
