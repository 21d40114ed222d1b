package com.samplepairs.app;

import com.opencsv.CSVWriter;
import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.PairKeys;
import com.samplepairs.pairing.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting pairs to CSV files using OpenCSV.
 * <p>
 * One row per pair: its index, both positions, titles and artists, and the dedupe key, so a pair
 * list can be reviewed in a spreadsheet next to the store.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {
        "Pair", "OriginalPos", "OriginalTitle", "OriginalArtist",
        "SampledPos", "SampledTitle", "SampledArtist", "PairKey"
    };

    private final Path outputDir;

    public CsvService(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes a list of pairs to a CSV file inside the output directory, creating it if needed.
     * @param pairs Pairs to export
     * @param filename Output CSV filename
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    @Override
    public Path writePairsToCSV(List<Pair> pairs, String filename) throws IOException {
        if (pairs == null) {
            logger.warn("Attempted to write null pair list to CSV: {}", filename);
            throw new IllegalArgumentException("Pair list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (int i = 0; i < pairs.size(); i++) {
                Pair pair = pairs.get(i);
                writer.writeNext(new String[]{
                    Integer.toString(i),
                    pair.originalPos() == null ? "" : pair.originalPos().toString(),
                    safe(title(pair.originalTrack())),
                    safe(artist(pair.originalTrack())),
                    pair.sampledPos() == null ? "" : pair.sampledPos().toString(),
                    safe(title(pair.sampledTrack())),
                    safe(artist(pair.sampledTrack())),
                    PairKeys.pairKey(pair)
                });
            }
        }
        logger.info("Wrote {} pairs to CSV file: {}", pairs.size(), target);
        return target;
    }

    private static String title(Track track) {
        return track == null ? null : track.title();
    }

    private static String artist(Track track) {
        return track == null ? null : track.artist();
    }

    /**
     * Collapses CR/LF characters into a single space and trims.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
