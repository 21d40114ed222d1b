package com.samplepairs.pairing;

/**
 * An original track together with the track that samples it.
 * <p>
 * Positions are the 1-based playlist positions the pair was built from. Pairs loaded from a store
 * written before positions were recorded carry null positions.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public record Pair(Track originalTrack, Track sampledTrack, Integer originalPos, Integer sampledPos) {

    /**
     * Lowest of the two positions, used to order built pairs. Missing positions sort last.
     */
    public int minPosition() {
        int o = originalPos == null ? Integer.MAX_VALUE : originalPos;
        int s = sampledPos == null ? Integer.MAX_VALUE : sampledPos;
        return Math.min(o, s);
    }
}
