package com.samplepairs.pairing;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalMergeStoreTest {
    private final CanonicalMergeStore store = new CanonicalMergeStore();

    private static Pair pair(String original, String sampled) {
        return new Pair(Track.of(original, "Artist"), Track.of(sampled, "Artist"), null, null);
    }

    @Test
    void testMergeWithNothingNewKeepsStore() {
        List<Pair> stored = List.of(pair("A", "B"), pair("C", "D"));
        assertEquals(stored, store.merge(stored, List.of()));
        assertEquals(stored, store.merge(stored, stored));
        assertEquals(stored, store.merge(stored, null));
        assertTrue(store.merge(null, null).isEmpty());
    }

    @Test
    void testStoredPairWinsOverIncomingDuplicate() {
        Pair stored = new Pair(Track.of("Every Breath I Take", "The Police").withDetail("spotifyUrl", "https://x"),
            Track.of("Missing You", "Puff Daddy"), null, null);
        Pair incoming = new Pair(Track.of("Every Breath I Take - Remastered", "the police"),
            Track.of("MISSING YOU", "Puff Daddy"), 1, 2);

        List<Pair> merged = store.merge(List.of(stored), List.of(incoming));
        assertEquals(1, merged.size());
        assertSame(stored, merged.get(0));
    }

    @Test
    void testFirstObservationOrderIsKept() {
        Pair a = pair("A", "B");
        Pair b = pair("C", "D");
        Pair c = pair("E", "F");
        List<Pair> merged = store.merge(List.of(b), List.of(c, a, b, c));
        assertEquals(List.of(b, c, a), merged);
    }

    @Test
    void testUnkeyablePairsAreDropped() {
        Pair good = pair("A", "B");
        List<Pair> incoming = Arrays.asList(null, new Pair(null, null, null, null),
            new Pair(Track.of("", ""), Track.of(null, null), 1, 2), good);
        assertEquals(List.of(good), store.merge(List.of(), incoming));
        assertTrue(store.findCollisions(List.of(), incoming).isEmpty());
    }

    @Test
    void testCollisionsAreClassified() {
        Pair stored = pair("A", "B");
        Pair again = pair("a", "b");
        Pair fresh = pair("C", "D");
        Pair freshTwice = pair("C ", "D");

        List<PairCollision> collisions = store.findCollisions(List.of(stored), List.of(again, fresh, freshTwice));
        assertEquals(2, collisions.size());
        assertSame(again, collisions.get(0).pair());
        assertEquals(CollisionReason.ALREADY_IN_STORE, collisions.get(0).reason());
        assertEquals("O:a|artist||S:b|artist", collisions.get(0).key());
        assertSame(freshTwice, collisions.get(1).pair());
        assertEquals(CollisionReason.DUPLICATE_WITHIN_BATCH, collisions.get(1).reason());
        assertEquals("duplicate_within_batch", collisions.get(1).reason().wireName());
    }

    @Test
    void testStoreCollisionTakesPrecedenceWithinBatch() {
        Pair stored = pair("A", "B");
        List<PairCollision> collisions = store.findCollisions(List.of(stored), List.of(pair("A", "B"), pair("A", "B")));
        assertEquals(2, collisions.size());
        assertEquals(CollisionReason.ALREADY_IN_STORE, collisions.get(0).reason());
        assertEquals(CollisionReason.ALREADY_IN_STORE, collisions.get(1).reason());
    }

    @Test
    void testMergeWithReport() {
        Pair stored = pair("A", "B");
        Pair fresh = pair("C", "D");
        MergeResult result = store.mergeWithReport(List.of(stored), List.of(pair("A", "B"), fresh, pair("C", "D")));
        assertEquals(List.of(stored, fresh), result.merged());
        assertEquals(List.of(fresh), result.added());
        assertEquals(2, result.collisions().size());
    }
}
