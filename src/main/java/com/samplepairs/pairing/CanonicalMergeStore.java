package com.samplepairs.pairing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines previously stored pairs with newly built ones, deduplicating by {@link PairKeys#pairKey(Pair)}.
 * <p>
 * The first occurrence of a key wins, so stored pairs always beat incoming duplicates and insertion
 * order is the order of first observation. Pairs without a usable key are dropped from the merged
 * collection.
 * <p>
 * This class is pure. Callers persisting the result (see {@code JsonPairStore}) must serialize
 * concurrent merges against the same store themselves.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class CanonicalMergeStore {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalMergeStore.class);

    /**
     * Folds {@code stored ++ incoming} keeping the first pair per key.
     * @param stored pairs already in the store (may be null)
     * @param incoming newly built pairs (may be null)
     * @return merged pairs in first-observation order
     */
    public List<Pair> merge(List<Pair> stored, List<Pair> incoming) {
        Map<String, Pair> byKey = new LinkedHashMap<>();
        int unkeyable = 0;
        for (List<Pair> source : List.of(nullToEmpty(stored), nullToEmpty(incoming))) {
            for (Pair pair : source) {
                String key = PairKeys.pairKey(pair);
                if (!PairKeys.isKeyable(key)) {
                    unkeyable++;
                    continue;
                }
                byKey.putIfAbsent(key, pair);
            }
        }
        if (unkeyable > 0) {
            logger.debug("Dropped {} unkeyable pair(s) while merging", unkeyable);
        }
        return new ArrayList<>(byKey.values());
    }

    /**
     * Classifies which incoming pairs collide with the store or with each other. Does not affect
     * {@link #merge(List, List)}.
     * @param stored pairs already in the store (may be null)
     * @param incoming newly built pairs (may be null)
     * @return one entry per colliding incoming pair, in incoming order
     */
    public List<PairCollision> findCollisions(List<Pair> stored, List<Pair> incoming) {
        Set<String> storedKeys = new HashSet<>();
        for (Pair pair : nullToEmpty(stored)) {
            String key = PairKeys.pairKey(pair);
            if (PairKeys.isKeyable(key)) storedKeys.add(key);
        }
        Set<String> batchKeys = new HashSet<>();
        List<PairCollision> collisions = new ArrayList<>();
        for (Pair pair : nullToEmpty(incoming)) {
            String key = PairKeys.pairKey(pair);
            if (!PairKeys.isKeyable(key)) continue;
            if (storedKeys.contains(key)) {
                collisions.add(new PairCollision(pair, key, CollisionReason.ALREADY_IN_STORE));
            } else if (!batchKeys.add(key)) {
                collisions.add(new PairCollision(pair, key, CollisionReason.DUPLICATE_WITHIN_BATCH));
            }
        }
        return collisions;
    }

    /**
     * Merges and reports in one call.
     */
    public MergeResult mergeWithReport(List<Pair> stored, List<Pair> incoming) {
        List<Pair> merged = merge(stored, incoming);
        List<PairCollision> collisions = findCollisions(stored, incoming);

        Set<String> storedKeys = new HashSet<>();
        for (Pair pair : nullToEmpty(stored)) storedKeys.add(PairKeys.pairKey(pair));
        List<Pair> added = new ArrayList<>();
        for (Pair pair : merged) {
            if (!storedKeys.contains(PairKeys.pairKey(pair))) added.add(pair);
        }
        logger.info("Merged {} stored and {} incoming pair(s): {} added, {} collision(s)",
            nullToEmpty(stored).size(), nullToEmpty(incoming).size(), added.size(), collisions.size());
        return new MergeResult(merged, added, collisions);
    }

    private static List<Pair> nullToEmpty(List<Pair> pairs) {
        return pairs == null ? List.of() : pairs;
    }
}
