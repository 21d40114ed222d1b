package com.samplepairs.pairing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text song metadata into strings that compare equal across formatting noise.
 * <p>
 * Workflow for titles:
 * <ul>
 *   <li>Lowercase, and turn hyphens, en-dashes and em-dashes into spaces.</li>
 *   <li>Drop every {@code (...)} and {@code [...]} group.</li>
 *   <li>Drop trailing annotation words such as "remastered 2003" or "radio edit".</li>
 *   <li>Keep only {@code [a-z0-9]} and whitespace, then collapse whitespace and trim.</li>
 * </ul>
 * The pass repeats until the value no longer changes, so normalizing twice is the same as
 * normalizing once. Artists are only lowercased and whitespace-collapsed.
 * <p>
 * Null or empty input always yields the empty string.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public final class TitleArtistNormalizer {

    private TitleArtistNormalizer() {}

    // Vocabulary order matters for ties once sorted by length.
    private static final List<String> TRAILING_ANNOTATIONS = List.of(
        "remastered", "remaster", "remix", "radio edit", "radio version",
        "edit", "mono", "stereo", "version", "single version", "album version",
        "extended", "extended version", "deluxe", "deluxe edition",
        "explicit", "clean", "instrumental", "acapella", "live"
    );

    private static final List<Pattern> TRAILING_PATTERNS = compileTrailingPatterns();

    private static final Pattern DASHES = Pattern.compile("[\\u2013\\u2014-]");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern BRACKETED = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static List<Pattern> compileTrailingPatterns() {
        List<String> sorted = new ArrayList<>(TRAILING_ANNOTATIONS);
        // List.sort is stable: equal lengths keep vocabulary order, so "radio edit" beats "edit".
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        List<Pattern> patterns = new ArrayList<>();
        for (String token : sorted) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(token) + "(?:\\s+\\d+)?\\b\\s*$", Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(patterns);
    }

    /**
     * Normalizes a song title for dedupe comparison.
     * @param title raw title (may be null)
     * @return normalized title, never null
     */
    public static String normalizeTitle(String title) {
        if (title == null || title.isEmpty()) return "";
        String current = title;
        while (true) {
            String next = normalizeTitleOnce(current);
            if (next.equals(current)) return next;
            current = next;
        }
    }

    private static String normalizeTitleOnce(String title) {
        String normalized = title.toLowerCase(Locale.ROOT);
        normalized = DASHES.matcher(normalized).replaceAll(" ");
        normalized = PARENTHESIZED.matcher(normalized).replaceAll("");
        normalized = BRACKETED.matcher(normalized).replaceAll("");
        for (Pattern pattern : TRAILING_PATTERNS) {
            normalized = pattern.matcher(normalized).replaceFirst("");
        }
        normalized = NON_ALNUM.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }

    /**
     * Normalizes an artist name: lowercase, collapse whitespace, trim. Punctuation is kept.
     * @param artist raw artist (may be null)
     * @return normalized artist, never null
     */
    public static String normalizeArtist(String artist) {
        if (artist == null || artist.isEmpty()) return "";
        return WHITESPACE.matcher(artist.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Plain text normalization: trim, collapse whitespace, lowercase.
     */
    public static String normalizeText(String s) {
        if (s == null || s.isEmpty()) return "";
        return WHITESPACE.matcher(s.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Stable key for a single track: {@code normalizedTitle|normalizedArtist}.
     * @param track track (may be null)
     * @return the key, or the empty string for a null track
     */
    public static String songKey(Track track) {
        if (track == null) return "";
        return normalizeTitle(track.title()) + "|" + normalizeArtist(track.artist());
    }
}
