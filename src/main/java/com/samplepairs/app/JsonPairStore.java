package com.samplepairs.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.samplepairs.pairing.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Pair store kept as a JSON array in a single file (by default {@code pairs.enriched.json}).
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #load()} accepts records in either pair shape and returns an empty list for a missing file.</li>
 *   <li>{@link #save(List)} writes a temporary file next to the store and moves it over the store.</li>
 * </ul>
 * No locking is done. Two processes merging into the same file at once can lose each other's pairs,
 * so callers must run merges against one file one at a time.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class JsonPairStore implements PairStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonPairStore.class);

    private final Path file;
    private final PairJsonMapper jsonMapper;

    public JsonPairStore(Path file) {
        this(file, new PairJsonMapper());
    }

    public JsonPairStore(Path file, PairJsonMapper jsonMapper) {
        if (file == null) {
            throw new IllegalArgumentException("Store path cannot be null");
        }
        this.file = file;
        this.jsonMapper = jsonMapper;
    }

    @Override
    public List<Pair> load() throws IOException {
        if (!Files.exists(file)) {
            logger.info("Pair store {} does not exist yet, starting empty", file);
            return List.of();
        }
        JsonNode root = jsonMapper.getMapper().readTree(file.toFile());
        if (root == null || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isArray()) {
            throw new IOException("Pair store " + file + " must contain a JSON array");
        }
        List<Pair> pairs = jsonMapper.readPairs(root);
        logger.info("Loaded {} pair(s) from {}", pairs.size(), file);
        return pairs;
    }

    @Override
    public void save(List<Pair> pairs) throws IOException {
        if (pairs == null) {
            throw new IllegalArgumentException("Pair list cannot be null");
        }
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            byte[] json = jsonMapper.getMapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(jsonMapper.writePairs(pairs));
            Files.write(tmp, json);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to plain replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.info("Wrote {} pair(s) to {}", pairs.size(), file);
    }
}
