package com.samplepairs.pairing;

/**
 * Derives the identity key of a pair from the normalized title and artist of both tracks.
 * <p>
 * Key format: {@code O:<title>|<artist>||S:<title>|<artist>}. Two pairs with equal keys are the
 * same semantic pair whatever their formatting differences.
 * <p>
 * A null pair yields the empty key and a null track yields an empty component. Keys for which
 * {@link #isKeyable(String)} is false must never be used as dedupe targets.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public final class PairKeys {

    static final String ORIGINAL_PREFIX = "O:";
    static final String SEPARATOR = "||S:";

    private PairKeys() {}

    /**
     * Computes the dedupe key of a pair.
     * @param pair pair (may be null)
     * @return the key, empty for a null pair
     */
    public static String pairKey(Pair pair) {
        if (pair == null) return "";
        return ORIGINAL_PREFIX + TitleArtistNormalizer.songKey(pair.originalTrack())
            + SEPARATOR + TitleArtistNormalizer.songKey(pair.sampledTrack());
    }

    /**
     * A key is usable for dedupe unless it is empty or neither track contributed a title or artist.
     */
    public static boolean isKeyable(String key) {
        if (key == null || key.isEmpty()) return false;
        int split = key.indexOf(SEPARATOR);
        if (!key.startsWith(ORIGINAL_PREFIX) || split < 0) return true;
        String original = key.substring(ORIGINAL_PREFIX.length(), split);
        String sampled = key.substring(split + SEPARATOR.length());
        return !(isBlankSongKey(original) && isBlankSongKey(sampled));
    }

    private static boolean isBlankSongKey(String songKey) {
        return songKey.isEmpty() || songKey.equals("|");
    }
}
