package com.samplepairs.pairing;

import java.util.List;

/**
 * Declarative description of how a playlist is split into pairs.
 * <p>
 * Built once per request by {@link PlanNormalizer}, checked by {@link PlanValidator} and consumed
 * by {@link PairBuilder}.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public record PairingPlan(List<TrioOverride> trios, List<RangeRule> ranges) {

    public PairingPlan {
        trios = trios == null ? List.of() : List.copyOf(trios);
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
    }
}
