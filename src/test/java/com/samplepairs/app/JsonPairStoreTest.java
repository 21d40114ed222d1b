package com.samplepairs.app;

import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.Track;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class JsonPairStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void testMissingFileLoadsEmpty() throws IOException {
        JsonPairStore store = new JsonPairStore(tempDir.resolve("pairs.enriched.json"));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void testSaveThenLoad() throws IOException {
        Path file = tempDir.resolve("nested").resolve("pairs.enriched.json");
        JsonPairStore store = new JsonPairStore(file);
        List<Pair> pairs = List.of(
            new Pair(Track.of("A", "X").withDetail("spotifyUrl", "u").withDetail("startSec", 0), Track.of("B", "Y"), 2, 1),
            new Pair(Track.of("C", "Z"), Track.of("D", "W"), null, null));
        store.save(pairs);

        assertTrue(Files.exists(file));
        assertEquals(pairs, store.load());
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count(), "temporary file left behind");
        }
    }

    @Test
    void testSaveReplacesPreviousContent() throws IOException {
        JsonPairStore store = new JsonPairStore(tempDir.resolve("store.json"));
        store.save(List.of(new Pair(Track.of("A", "X"), Track.of("B", "Y"), 1, 2)));
        store.save(List.of());
        assertTrue(store.load().isEmpty());
    }

    @Test
    void testLegacyExportShapeLoads() throws IOException {
        Path file = tempDir.resolve("legacy.json");
        Files.writeString(file, "[{\"original\": {\"title\": \"A\", \"artist\": \"X\"},"
            + " \"sampled\": {\"title\": \"B\", \"artist\": \"Y\"}}]", StandardCharsets.UTF_8);
        List<Pair> pairs = new JsonPairStore(file).load();
        assertEquals(1, pairs.size());
        assertEquals("A", pairs.get(0).originalTrack().title());
        assertNull(pairs.get(0).originalPos());
    }

    @Test
    void testNonArrayStoreIsRejected() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"pairs\": []}", StandardCharsets.UTF_8);
        JsonPairStore store = new JsonPairStore(file);
        assertThrows(IOException.class, store::load);
    }

    @Test
    void testNullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JsonPairStore(null));
        JsonPairStore store = new JsonPairStore(tempDir.resolve("x.json"));
        assertThrows(IllegalArgumentException.class, () -> store.save(null));
    }
}
