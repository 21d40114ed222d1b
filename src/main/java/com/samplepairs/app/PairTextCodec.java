package com.samplepairs.app;

import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.Track;
import com.samplepairs.pairing.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human-editable text form of a pair list.
 * <pre>
 * Pair 0
 * Original: Title — Artist
 * Sampled: Title — Artist
 * </pre>
 * Users review and correct this text before it is turned into enriched JSON.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public final class PairTextCodec {

    private static final Pattern PAIR_LINE = Pattern.compile("^Pair\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORIGINAL_LINE = Pattern.compile("^Original:\\s*(.+?)\\s*—\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAMPLED_LINE = Pattern.compile("^Sampled:\\s*(.+?)\\s*—\\s*(.+)$", Pattern.CASE_INSENSITIVE);

    private PairTextCodec() {}

    /**
     * A pair block read back from text. Either track may be null when its line was missing.
     */
    public record ParsedPair(int pairNumber, Track original, Track sampled) {
        public Pair toPair() {
            return new Pair(original, sampled, null, null);
        }
    }

    /**
     * Renders pairs as numbered text blocks, numbering from 0.
     */
    public static String format(List<Pair> pairs) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < pairs.size(); i++) {
            Pair pair = pairs.get(i);
            text.append("Pair ").append(i).append('\n');
            text.append("Original: ").append(describe(pair.originalTrack())).append('\n');
            text.append("Sampled: ").append(describe(pair.sampledTrack())).append("\n\n");
        }
        return text.toString();
    }

    private static String describe(Track track) {
        if (track == null) return " — ";
        return nullToEmpty(track.title()) + " — " + nullToEmpty(track.artist());
    }

    /**
     * Parses text blocks. Blank and unrecognized lines are skipped; Original/Sampled lines before the
     * first {@code Pair N} header are ignored.
     */
    public static List<ParsedPair> parse(String text) {
        List<ParsedPair> pairs = new ArrayList<>();
        if (text == null) return pairs;
        Integer pairNumber = null;
        Track original = null;
        Track sampled = null;
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            if (line.isEmpty()) continue;

            Matcher m = PAIR_LINE.matcher(line);
            if (m.find()) {
                if (pairNumber != null) pairs.add(new ParsedPair(pairNumber, original, sampled));
                pairNumber = Integer.parseInt(m.group(1));
                original = null;
                sampled = null;
                continue;
            }
            if (pairNumber == null) continue;

            m = ORIGINAL_LINE.matcher(line);
            if (m.matches()) {
                original = Track.of(m.group(1).trim(), m.group(2).trim());
                continue;
            }
            m = SAMPLED_LINE.matcher(line);
            if (m.matches()) {
                sampled = Track.of(m.group(1).trim(), m.group(2).trim());
            }
        }
        if (pairNumber != null) pairs.add(new ParsedPair(pairNumber, original, sampled));
        return pairs;
    }

    /**
     * Every parsed pair needs both tracks.
     */
    public static ValidationResult validate(List<ParsedPair> pairs) {
        List<String> errors = new ArrayList<>();
        for (ParsedPair pair : pairs) {
            if (pair.original() == null) {
                errors.add("Pair " + pair.pairNumber() + " is missing the Original track");
            }
            if (pair.sampled() == null) {
                errors.add("Pair " + pair.pairNumber() + " is missing the Sampled track");
            }
        }
        return ValidationResult.of(errors);
    }

    /**
     * Lists tracks (exact title and artist) that occur more than once across the parsed pairs,
     * each reported once, as {@code "Title" by Artist}.
     */
    public static List<String> findDuplicateTracks(List<ParsedPair> pairs) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (ParsedPair pair : pairs) {
            for (Track track : new Track[]{pair.original(), pair.sampled()}) {
                if (track == null) continue;
                String key = track.title() + "|" + track.artist();
                if (!seen.add(key)) {
                    duplicates.add("\"" + track.title() + "\" by " + track.artist());
                }
            }
        }
        return new ArrayList<>(duplicates);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
