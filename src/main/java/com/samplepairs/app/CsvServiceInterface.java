package com.samplepairs.app;

import com.samplepairs.pairing.Pair;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of pair data.
 */
public interface CsvServiceInterface {
    /**
     * Writes a list of pairs to a CSV file with a header row.
     * @param pairs Pairs to export
     * @param filename Name of the output CSV file, resolved against the output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writePairsToCSV(List<Pair> pairs, String filename) throws IOException;
}
