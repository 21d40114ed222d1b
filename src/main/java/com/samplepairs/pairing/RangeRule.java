package com.samplepairs.pairing;

/**
 * Pairs every unused position in {@code [start, end]} (1-based, inclusive) by parity.
 */
public record RangeRule(int start, int end, MappingType mapping) {

    public boolean covers(int position) {
        return position >= start && position <= end;
    }

    /**
     * Two ranges overlap when they share a position. Ranges that merely touch
     * ({@code [1,5]} and {@code [6,10]}) do not.
     */
    public boolean overlaps(RangeRule other) {
        boolean overlap = end >= other.start && other.end >= start;
        boolean touching = end + 1 == other.start || other.end + 1 == start;
        return overlap && !touching;
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end + "]";
    }
}
