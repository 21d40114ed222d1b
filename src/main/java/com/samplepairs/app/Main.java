package com.samplepairs.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.samplepairs.pairing.MergeResult;
import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.PairCollision;
import com.samplepairs.pairing.PairingException;
import com.samplepairs.pairing.Track;
import com.samplepairs.pairing.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the sample pairs tool.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code pairs}: pair a playlist (tracks file or catalog playlist), write text and CSV, merge into the store.</li>
 *   <li>{@code import}: replace the store with pairs from an export document.</li>
 *   <li>{@code enrich}: turn reviewed pair text into catalog-enriched JSON.</li>
 * </ul>
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String PAIRS_TEXT_FILE = "playlist_pairs.txt";

    private final PairingService pairingService;
    private final PairJsonMapper jsonMapper;

    public Main() {
        this(new PairingService(), new PairJsonMapper());
    }

    public Main(PairingService pairingService, PairJsonMapper jsonMapper) {
        this.pairingService = pairingService;
        this.jsonMapper = jsonMapper;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int status = new Main().run(args);
        if (status != 0) System.exit(status);
    }

    /**
     * Runs one command.
     * @param args Command-line arguments
     * @return process exit status: 0 success, 1 failure, 2 usage error
     */
    public int run(String[] args) {
        AppConfig config;
        try {
            config = AppConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            System.err.println(AppConfig.usage());
            return 2;
        }
        if (config.help()) {
            System.out.println(AppConfig.usage());
            return 0;
        }
        try {
            return switch (config.mode()) {
                case "pairs" -> runPairs(config, null);
                case "import" -> runImport(config);
                case "enrich" -> runEnrich(config, null);
                default -> {
                    logger.error("Unknown mode: {}", config.mode());
                    System.err.println(AppConfig.usage());
                    yield 2;
                }
            };
        } catch (PairingException e) {
            logger.error("Pairing failed: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("I/O failure: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Pairs a playlist and merges the result into the store.
     * @param catalog catalog to fetch a playlist from; null builds one from the configured credentials
     */
    int runPairs(AppConfig config, CatalogServiceInterface catalog) throws IOException {
        List<Track> tracks;
        String baseName;
        if (config.tracksPath() != null) {
            tracks = jsonMapper.readTracks(readJson(config.tracksPath()));
            baseName = stripExtension(config.tracksPath().getFileName().toString());
        } else if (config.playlist() != null) {
            String playlistId = SpotifyCatalogService.parsePlaylistId(config.playlist());
            if (playlistId == null) {
                throw new IllegalArgumentException("Invalid Spotify playlist URL or URI: " + config.playlist());
            }
            CatalogServiceInterface source = catalog != null ? catalog
                : new SpotifyCatalogService(config.spotifyClientId(), config.spotifyClientSecret());
            try {
                tracks = source.fetchPlaylistTracks(playlistId);
            } catch (CatalogException e) {
                if (!e.isNotFound()) throw e;
                logger.error("Playlist {} not found. Check that it exists and is public.", playlistId);
                return 1;
            }
            baseName = playlistId;
        } else {
            throw new IllegalArgumentException("pairs mode needs --tracks or --playlist");
        }

        tracks = pairingService.applyCutoff(tracks, config.cutoff());
        JsonNode plan = config.planPath() == null ? null : readJson(config.planPath());
        PairingOutcome outcome = pairingService.createPairs(tracks, plan);
        if (!outcome.isOk()) {
            logger.error("Invalid pairing plan:");
            outcome.errors().forEach(error -> logger.error("  {}", error));
            return 1;
        }
        if (!outcome.leftoverPositions().isEmpty()) {
            logger.warn("Unpaired positions: {}", outcome.leftoverPositions());
        }

        Files.createDirectories(config.outputDir());
        Path text = config.outputDir().resolve(PAIRS_TEXT_FILE);
        Files.writeString(text, PairTextCodec.format(outcome.pairs()), StandardCharsets.UTF_8);
        logger.info("Wrote {} pair(s) to {}", outcome.pairs().size(), text);
        new CsvService(config.outputDir()).writePairsToCSV(outcome.pairs(), Utils.sanitizeFilename(baseName) + "_pairs.csv");

        MergeResult merge = pairingService.mergeIntoStore(new JsonPairStore(config.storePath(), jsonMapper), outcome.pairs());
        for (PairCollision collision : merge.collisions()) {
            logger.info("Skipped {} -> {}: {}", describe(collision.pair().originalTrack()),
                describe(collision.pair().sampledTrack()), collision.reason().wireName());
        }
        logger.info("Store {} now holds {} pair(s) ({} new)", config.storePath(), merge.merged().size(), merge.added().size());
        return 0;
    }

    /**
     * Replaces the store with the pairs of an export document.
     */
    int runImport(AppConfig config) throws IOException {
        if (config.inputPath() == null) {
            throw new IllegalArgumentException("import mode needs --input");
        }
        List<Pair> pairs = jsonMapper.readImportedPairs(readJson(config.inputPath()));
        new JsonPairStore(config.storePath(), jsonMapper).save(pairs);
        logger.info("Imported {} pairs to {}", pairs.size(), config.storePath());
        return 0;
    }

    /**
     * Parses reviewed pair text, looks every track up in the catalog and writes export JSON.
     * @param catalog catalog to search; null builds one from the configured credentials
     */
    int runEnrich(AppConfig config, CatalogServiceInterface catalog) throws IOException {
        if (config.inputPath() == null || config.outputPath() == null) {
            throw new IllegalArgumentException("enrich mode needs --input and --output");
        }
        List<PairTextCodec.ParsedPair> parsed = PairTextCodec.parse(Files.readString(config.inputPath(), StandardCharsets.UTF_8));
        if (parsed.isEmpty()) {
            logger.error("No valid pairs found in {}. Please check the format.", config.inputPath());
            return 1;
        }
        ValidationResult validation = PairTextCodec.validate(parsed);
        if (!validation.isOk()) {
            logger.error("{}", validation.getErrorMessage());
            return 1;
        }
        List<String> duplicates = PairTextCodec.findDuplicateTracks(parsed);
        if (!duplicates.isEmpty()) {
            logger.warn("Duplicate tracks detected: {}", String.join("; ", duplicates));
        }

        CatalogServiceInterface source = catalog != null ? catalog
            : new SpotifyCatalogService(config.spotifyClientId(), config.spotifyClientSecret());
        List<Pair> pairs = new ArrayList<>();
        for (PairTextCodec.ParsedPair p : parsed) pairs.add(p.toPair());
        List<Pair> enriched = pairingService.enrichPairs(pairs, source);

        ArrayNode out = jsonMapper.getMapper().createArrayNode();
        for (int i = 0; i < enriched.size(); i++) {
            out.add(jsonMapper.writeExportPair(i, enriched.get(i)));
        }
        Path parent = config.outputPath().toAbsolutePath().getParent();
        Files.createDirectories(parent);
        jsonMapper.getMapper().writerWithDefaultPrettyPrinter().writeValue(config.outputPath().toFile(), out);
        logger.info("Wrote {} enriched pair(s) to {}", enriched.size(), config.outputPath());
        return 0;
    }

    private JsonNode readJson(Path path) throws IOException {
        return jsonMapper.getMapper().readTree(path.toFile());
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String describe(Track track) {
        return track == null ? "?" : "\"" + track.title() + "\" by " + track.artist();
    }
}
