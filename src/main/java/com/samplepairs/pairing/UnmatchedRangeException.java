package com.samplepairs.pairing;

/**
 * A range whose unused positions split into different numbers of originals and samples.
 * The plan passed validation but cannot be paired; the build is aborted.
 */
public class UnmatchedRangeException extends PairingException {
    private final int rangeIndex;
    private final RangeRule range;
    private final int originalCount;
    private final int sampleCount;

    public UnmatchedRangeException(int rangeIndex, RangeRule range, int originalCount, int sampleCount) {
        super(String.format("Range %d %s: unmatched tracks (%d originals, %d samples)",
            rangeIndex, range, originalCount, sampleCount));
        this.rangeIndex = rangeIndex;
        this.range = range;
        this.originalCount = originalCount;
        this.sampleCount = sampleCount;
    }

    /** 1-based index of the range in plan order. */
    public int getRangeIndex() {
        return rangeIndex;
    }

    public RangeRule getRange() {
        return range;
    }

    public int getOriginalCount() {
        return originalCount;
    }

    public int getSampleCount() {
        return sampleCount;
    }
}
