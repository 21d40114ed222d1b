package com.samplepairs.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.samplepairs.pairing.CanonicalMergeStore;
import com.samplepairs.pairing.MergeResult;
import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.PairBuildResult;
import com.samplepairs.pairing.PairBuilder;
import com.samplepairs.pairing.PairingException;
import com.samplepairs.pairing.PairingPlan;
import com.samplepairs.pairing.PlanNormalizer;
import com.samplepairs.pairing.PlanValidator;
import com.samplepairs.pairing.Track;
import com.samplepairs.pairing.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Request-level workflow around the pairing core.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Optionally cuts the playlist at an even track number.</li>
 *   <li>With a plan: normalize, validate (errors are returned, not thrown), build.</li>
 *   <li>Without a plan: sequential pairing, warning about duplicate tracks.</li>
 *   <li>Merges built pairs into a {@link PairStoreInterface}: one load, one save.</li>
 *   <li>Enriches pairs parsed from text with catalog data.</li>
 * </ul>
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class PairingService {
    private static final Logger logger = LoggerFactory.getLogger(PairingService.class);

    /**
     * A track title and artist seen at more than one playlist position.
     */
    public record TrackDuplicate(Track track, int firstPosition, int position) {}

    private final PlanNormalizer normalizer;
    private final PlanValidator validator;
    private final PairBuilder builder;
    private final CanonicalMergeStore mergeStore;

    public PairingService() {
        this(new PlanNormalizer(), new PlanValidator(), new PairBuilder(), new CanonicalMergeStore());
    }

    public PairingService(PlanNormalizer normalizer, PlanValidator validator, PairBuilder builder, CanonicalMergeStore mergeStore) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.builder = builder;
        this.mergeStore = mergeStore;
    }

    /**
     * Truncates the playlist after {@code cutoff} tracks (1-based, inclusive).
     * @param tracks playlist tracks
     * @param cutoff cutoff as entered by the user; null or blank means no cutoff
     * @return the (possibly truncated) tracks
     * @throws PairingException if the cutoff is not a number in {@code [1, tracks.size()]} or is odd
     */
    public List<Track> applyCutoff(List<Track> tracks, String cutoff) {
        if (cutoff == null || cutoff.isBlank()) return tracks;
        OptionalInt parsed = PlanNormalizer.parseLeadingInt(TextNode.valueOf(cutoff));
        int total = tracks.size();
        if (parsed.isEmpty() || parsed.getAsInt() < 1 || parsed.getAsInt() > total) {
            throw new PairingException(String.format("Invalid cutoff track number. Must be between 1 and %d.", total));
        }
        int value = parsed.getAsInt();
        if (value % 2 != 0) {
            throw new PairingException("Cutoff track number must be even to form complete pairs.");
        }
        return List.copyOf(tracks.subList(0, value));
    }

    /**
     * Builds pairs for a playlist.
     * @param tracks playlist tracks
     * @param rawPlan raw pairing plan, or null for sequential pairing
     * @return outcome; a rejected plan yields its validation errors
     * @throws PairingException if sequential pairing meets an odd track count, or a range cannot be paired
     */
    public PairingOutcome createPairs(List<Track> tracks, JsonNode rawPlan) {
        if (rawPlan == null || rawPlan.isNull() || rawPlan.isMissingNode()) {
            List<TrackDuplicate> duplicates = findDuplicateTracks(tracks);
            for (TrackDuplicate dup : duplicates) {
                logger.warn("Duplicate track \"{}\" by {} at positions {}, {}",
                    dup.track().title(), dup.track().artist(), dup.firstPosition(), dup.position());
            }
            List<Pair> pairs = builder.buildSequential(tracks);
            return new PairingOutcome(pairs, List.of(), List.of(), false);
        }

        logger.info("Using pairing plan for {} tracks", tracks.size());
        PairingPlan plan = normalizer.normalize(rawPlan, tracks.size());
        ValidationResult validation = validator.validate(plan, tracks.size());
        if (!validation.isOk()) {
            logger.warn("Pairing plan validation failed: {}", validation.getErrors());
            return PairingOutcome.rejected(validation.getErrors());
        }
        PairBuildResult result = builder.build(tracks, plan);
        return new PairingOutcome(result.pairs(), result.leftoverPositions(), List.of(), true);
    }

    /**
     * Finds tracks whose exact title and artist already appeared earlier in the playlist.
     */
    public List<TrackDuplicate> findDuplicateTracks(List<Track> tracks) {
        Map<String, Integer> seen = new HashMap<>();
        List<TrackDuplicate> duplicates = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            Track track = tracks.get(i);
            String key = track.title() + "|" + track.artist();
            Integer first = seen.putIfAbsent(key, i + 1);
            if (first != null) {
                duplicates.add(new TrackDuplicate(track, first, i + 1));
            }
        }
        return duplicates;
    }

    /**
     * Loads the store, merges the new pairs into it and saves it.
     * The caller must not run two merges against the same store at once.
     * @param store canonical pair store
     * @param incoming newly built pairs
     * @return merged collection plus collision diagnostics
     * @throws IOException if the store cannot be read or written
     */
    public MergeResult mergeIntoStore(PairStoreInterface store, List<Pair> incoming) throws IOException {
        List<Pair> stored = store.load();
        MergeResult result = mergeStore.mergeWithReport(stored, incoming);
        store.save(result.merged());
        return result;
    }

    /**
     * Looks every track up in the catalog. Found tracks get {@code spotifyUrl} and {@code album};
     * the rest are marked {@code placeholder}.
     * @param pairs pairs with title/artist-only tracks
     * @param catalog catalog to search
     * @return enriched pairs in the same order
     * @throws IOException if the catalog rejects the lookups as a whole (e.g. bad credentials)
     */
    public List<Pair> enrichPairs(List<Pair> pairs, CatalogServiceInterface catalog) throws IOException {
        List<Pair> enriched = new ArrayList<>();
        for (Pair pair : pairs) {
            enriched.add(new Pair(
                enrichTrack(pair.originalTrack(), catalog),
                enrichTrack(pair.sampledTrack(), catalog),
                pair.originalPos(),
                pair.sampledPos()));
        }
        logger.info("Enriched {} pair(s) from catalog", enriched.size());
        return enriched;
    }

    private Track enrichTrack(Track track, CatalogServiceInterface catalog) throws IOException {
        if (track == null) return null;
        CatalogServiceInterface.CatalogMatch match = catalog.searchTrack(track.title(), track.artist());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("era", "");
        details.put("youtubeId", "");
        details.put("startSec", 0);
        details.put("rawTitle", "");
        details.put("releaseDate", "");
        details.put("spotifyUrl", match.found() ? match.url() : "");
        details.put("album", match.found() ? match.album() : "");
        Track enriched = new Track(track.title(), track.artist(), details);
        return match.found() ? enriched : enriched.withDetail("placeholder", true);
    }
}
