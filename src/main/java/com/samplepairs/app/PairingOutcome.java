package com.samplepairs.app;

import com.samplepairs.pairing.Pair;

import java.util.List;

/**
 * What a pairing request produced.
 * @param pairs built pairs, empty when the plan was rejected
 * @param leftoverPositions positions no pair used
 * @param errors plan validation errors; non-empty means the plan was rejected
 * @param advanced true when a pairing plan was applied, false for sequential pairing
 */
public record PairingOutcome(List<Pair> pairs, List<Integer> leftoverPositions, List<String> errors, boolean advanced) {

    public PairingOutcome {
        pairs = List.copyOf(pairs);
        leftoverPositions = List.copyOf(leftoverPositions);
        errors = List.copyOf(errors);
    }

    public static PairingOutcome rejected(List<String> errors) {
        return new PairingOutcome(List.of(), List.of(), errors, true);
    }

    public boolean isOk() {
        return errors.isEmpty();
    }
}
