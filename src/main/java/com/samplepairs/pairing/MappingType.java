package com.samplepairs.pairing;

/**
 * Which parity of positions inside a range plays the "original" role.
 */
public enum MappingType {
    /** Even positions are originals, odd positions are samples. */
    EVEN_ORIGINAL,
    /** Odd positions are originals, even positions are samples. */
    ODD_ORIGINAL;

    /**
     * Returns true if the track at {@code position} is an original under this mapping.
     */
    public boolean isOriginal(int position) {
        boolean even = position % 2 == 0;
        return this == EVEN_ORIGINAL ? even : !even;
    }

    /**
     * Parses an exact, trimmed mapping name. Returns null for anything else.
     */
    public static MappingType parse(String raw) {
        if (raw == null) return null;
        String value = raw.trim();
        for (MappingType type : values()) {
            if (type.name().equals(value)) return type;
        }
        return null;
    }
}
