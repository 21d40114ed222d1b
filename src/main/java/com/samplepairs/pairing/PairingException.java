package com.samplepairs.pairing;

/**
 * Raised when a playlist cannot be turned into pairs at all.
 * <p>
 * Validation problems are not exceptions; they are returned by {@link PlanValidator}. This type is
 * reserved for conditions that must abort the whole request.
 */
public class PairingException extends RuntimeException {

    public PairingException(String message) {
        super(message);
    }

    /**
     * Sequential pairing needs an even number of tracks.
     */
    public static PairingException oddTrackCount(int trackCount) {
        return new PairingException("odd: cannot pair " + trackCount + " tracks sequentially, the count must be even");
    }
}
