package com.samplepairs.pairing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a validated {@link PairingPlan} and the playlist tracks into an ordered list of pairs.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Trios first, in plan order: each emits (original, sampleA) and (original, sampleB).</li>
 *   <li>Ranges next, in plan order: the unused positions of the range are split by parity according
 *       to the range mapping and the i-th original is paired with the i-th sample.</li>
 *   <li>Positions never used are reported as leftovers. This is a warning only.</li>
 *   <li>The result is sorted by the lower position of each pair.</li>
 * </ul>
 * A range whose originals and samples differ in number aborts the build with
 * {@link UnmatchedRangeException}. The algorithm is deterministic.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class PairBuilder {
    private static final Logger logger = LoggerFactory.getLogger(PairBuilder.class);

    /**
     * Builds pairs from tracks using a validated plan.
     * @param tracks playlist tracks, position {@code p} is {@code tracks.get(p - 1)}
     * @param plan validated plan
     * @return pairs sorted by lowest position, plus leftover positions
     * @throws UnmatchedRangeException if a range has unequal original and sample counts
     * @throws IllegalArgumentException if the plan refers to a position beyond the track list
     */
    public PairBuildResult build(List<Track> tracks, PairingPlan plan) {
        if (tracks == null || plan == null) {
            throw new IllegalArgumentException("Tracks and plan are required");
        }
        List<Pair> pairs = new ArrayList<>();
        Set<Integer> used = new HashSet<>();
        logger.debug("Building pairs from {} tracks", tracks.size());

        for (int i = 0; i < plan.trios().size(); i++) {
            TrioOverride trio = plan.trios().get(i);
            logger.debug("Trio {}: original at {}, samples at {}, {}", i + 1, trio.original(), trio.sampleA(), trio.sampleB());
            pairs.add(pairAt(tracks, trio.original(), trio.sampleA()));
            pairs.add(pairAt(tracks, trio.original(), trio.sampleB()));
            used.add(trio.sampleA());
            used.add(trio.sampleB());
        }
        for (TrioOverride trio : plan.trios()) {
            used.add(trio.original());
        }

        for (int i = 0; i < plan.ranges().size(); i++) {
            RangeRule range = plan.ranges().get(i);
            List<Integer> originals = new ArrayList<>();
            List<Integer> samples = new ArrayList<>();
            for (int pos = range.start(); pos <= range.end(); pos++) {
                if (used.contains(pos)) continue;
                if (range.mapping().isOriginal(pos)) {
                    originals.add(pos);
                } else {
                    samples.add(pos);
                }
            }
            if (originals.size() != samples.size()) {
                UnmatchedRangeException e = new UnmatchedRangeException(i + 1, range, originals.size(), samples.size());
                logger.error(e.getMessage());
                throw e;
            }
            for (int k = 0; k < originals.size(); k++) {
                int originalPos = originals.get(k);
                int sampledPos = samples.get(k);
                pairs.add(pairAt(tracks, originalPos, sampledPos));
                used.add(originalPos);
                used.add(sampledPos);
            }
            logger.debug("Range {} {} with {}: created {} pair(s)", i + 1, range, range.mapping(), originals.size());
        }

        List<Integer> leftovers = new ArrayList<>();
        for (int pos = 1; pos <= tracks.size(); pos++) {
            if (!used.contains(pos)) leftovers.add(pos);
        }
        if (!leftovers.isEmpty()) {
            logger.warn("{} track(s) not paired: positions {}", leftovers.size(), leftovers);
        }

        pairs.sort(Comparator.comparingInt(Pair::minPosition));
        logger.info("Built {} pair(s) from {} tracks", pairs.size(), tracks.size());
        return new PairBuildResult(pairs, leftovers);
    }

    /**
     * Default pairing used when no plan is given: (1,2), (3,4), ...
     * @param tracks playlist tracks
     * @return N/2 pairs in playlist order
     * @throws PairingException if the number of tracks is odd
     */
    public List<Pair> buildSequential(List<Track> tracks) {
        if (tracks == null) {
            throw new IllegalArgumentException("Tracks are required");
        }
        if (tracks.size() % 2 != 0) {
            throw PairingException.oddTrackCount(tracks.size());
        }
        List<Pair> pairs = new ArrayList<>(tracks.size() / 2);
        for (int pos = 1; pos < tracks.size(); pos += 2) {
            pairs.add(pairAt(tracks, pos, pos + 1));
        }
        return pairs;
    }

    private static Pair pairAt(List<Track> tracks, int originalPos, int sampledPos) {
        return new Pair(trackAt(tracks, originalPos), trackAt(tracks, sampledPos), originalPos, sampledPos);
    }

    private static Track trackAt(List<Track> tracks, int position) {
        if (position < 1 || position > tracks.size()) {
            throw new IllegalArgumentException(String.format("Position %d is outside the track list [1..%d]", position, tracks.size()));
        }
        return tracks.get(position - 1);
    }
}
