package com.samplepairs.pairing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record representing one track of a playlist.
 * <p>
 * Only {@code title} and {@code artist} take part in pairing and deduplication. Every other field
 * a catalog or an earlier export attached to the track (catalog URL, media id, start offset, album,
 * era, ...) is kept in {@code details} in its original order and written back unchanged.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public record Track(String title, String artist, Map<String, Object> details) {

    public Track {
        details = details == null || details.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Creates a track without enrichment details.
     */
    public static Track of(String title, String artist) {
        return new Track(title, artist, Map.of());
    }

    /**
     * Returns the enrichment value stored under {@code name}, or null if absent.
     */
    public Object detail(String name) {
        return details.get(name);
    }

    /**
     * Returns a copy of this track with one enrichment value added or replaced.
     */
    public Track withDetail(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(name, value);
        return new Track(title, artist, copy);
    }
}
