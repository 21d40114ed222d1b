package com.samplepairs.pairing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural and coverage rules of a normalized {@link PairingPlan}.
 * <p>
 * Validation never stops at the first problem: all violations are collected so a caller can show
 * the complete defect list at once.
 * <ul>
 *   <li>At least one range is required, even when trios cover the whole playlist.</li>
 *   <li>Trio positions must be in bounds, pairwise distinct, and not reused by another trio.</li>
 *   <li>Range bounds must be in bounds and ordered; ranges may touch but not overlap.</li>
 *   <li>Every position outside the trios is covered by exactly one range.</li>
 * </ul>
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class PlanValidator {

    /**
     * Validates a plan against a playlist of {@code trackCount} tracks.
     * @param plan normalized plan
     * @param trackCount number of tracks
     * @return result carrying every error found; ok iff the list is empty
     */
    public ValidationResult validate(PairingPlan plan, int trackCount) {
        List<String> errors = new ArrayList<>();
        List<TrioOverride> trios = plan == null ? List.of() : plan.trios();
        List<RangeRule> ranges = plan == null ? List.of() : plan.ranges();

        if (ranges.isEmpty()) {
            errors.add("Pairing plan must have at least one range rule");
        }

        Set<Integer> trioTracks = validateTrios(trios, trackCount, errors);
        validateRanges(ranges, trackCount, errors);
        validateCoverage(ranges, trioTracks, trackCount, errors);

        return ValidationResult.of(errors);
    }

    private Set<Integer> validateTrios(List<TrioOverride> trios, int trackCount, List<String> errors) {
        Set<Integer> trioTracks = new HashSet<>();
        for (int i = 0; i < trios.size(); i++) {
            TrioOverride trio = trios.get(i);
            List<Integer> tracks = trio.positions();
            for (int track : tracks) {
                if (track < 1 || track > trackCount) {
                    errors.add(String.format("Trio %d: track %d is out of range [1..%d]", i + 1, track, trackCount));
                }
            }
            Set<Integer> distinct = new LinkedHashSet<>(tracks);
            if (distinct.size() != 3) {
                errors.add(String.format("Trio %d: must contain 3 distinct track numbers (got: %d, %d, %d)",
                    i + 1, trio.original(), trio.sampleA(), trio.sampleB()));
            }
            // Repeats inside one trio are reported above; only reuse across trios counts here.
            for (int track : distinct) {
                if (!trioTracks.add(track)) {
                    errors.add(String.format("Track %d appears in multiple trios", track));
                }
            }
        }
        return trioTracks;
    }

    private void validateRanges(List<RangeRule> ranges, int trackCount, List<String> errors) {
        for (int i = 0; i < ranges.size(); i++) {
            RangeRule range = ranges.get(i);
            if (range.start() < 1 || range.start() > trackCount) {
                errors.add(String.format("Range %d: start %d is out of range [1..%d]", i + 1, range.start(), trackCount));
            }
            if (range.end() < 1 || range.end() > trackCount) {
                errors.add(String.format("Range %d: end %d is out of range [1..%d]", i + 1, range.end(), trackCount));
            }
            if (range.start() > range.end()) {
                errors.add(String.format("Range %d: start (%d) must be <= end (%d)", i + 1, range.start(), range.end()));
            }
        }

        for (int i = 0; i < ranges.size(); i++) {
            for (int j = i + 1; j < ranges.size(); j++) {
                RangeRule a = ranges.get(i);
                RangeRule b = ranges.get(j);
                if (a.overlaps(b)) {
                    errors.add(String.format("Ranges %d %s and %d %s overlap", i + 1, a, j + 1, b));
                }
            }
        }
    }

    private void validateCoverage(List<RangeRule> ranges, Set<Integer> trioTracks, int trackCount, List<String> errors) {
        for (int track = 1; track <= trackCount; track++) {
            if (trioTracks.contains(track)) continue;
            int covering = 0;
            for (RangeRule range : ranges) {
                if (range.covers(track)) covering++;
            }
            if (covering == 0) {
                errors.add(String.format("Track %d is not covered by any range and is not in a trio", track));
            } else if (covering > 1) {
                errors.add(String.format("Track %d is covered by multiple ranges (only one allowed)", track));
            }
        }
    }
}
