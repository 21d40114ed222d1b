package com.samplepairs.app;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line configuration.
 *
 * Supports:
 *  - mode:         pairs | import | enrich (first positional argument, default pairs)
 *  - tracksPath:   JSON array of tracks to pair (pairs mode)
 *  - playlist:     catalog playlist URL or URI to fetch instead of a tracks file (pairs mode)
 *  - planPath:     optional JSON pairing plan; without it tracks are paired sequentially
 *  - cutoff:       optional even track number after which the playlist is cut
 *  - storePath:    canonical pair store (env PAIRS_STORE_PATH)
 *  - outputDir:    directory for text and CSV output (env PAIRS_OUTPUT_DIR)
 *  - inputPath:    input file for import / enrich
 *  - outputPath:   output file for enrich
 *  - spotifyClientId / spotifyClientSecret: catalog credentials (env SPOTIFY_CLIENT_ID / SPOTIFY_CLIENT_SECRET)
 */
public record AppConfig(
        String mode,
        Path tracksPath,
        String playlist,
        Path planPath,
        String cutoff,
        Path storePath,
        Path outputDir,
        Path inputPath,
        Path outputPath,
        String spotifyClientId,
        String spotifyClientSecret,
        boolean help
) {

    public static final String DEFAULT_STORE = "pairs.enriched.json";
    public static final String DEFAULT_OUTPUT_DIR = "pair-data";

    /**
     * Parses CLI flags. Flags not given fall back to environment variables, then system properties.
     *
     * Supported flags:
     *   --tracks,   -t <path>
     *   --playlist, -l <url>
     *   --plan,     -p <path>
     *   --cutoff,   -c <n>
     *   --store,    -s <path>
     *   --out-dir,  -o <dir>
     *   --input,    -i <path>
     *   --output       <path>
     *   --help,     -h
     *
     * @throws IllegalArgumentException for unknown flags or flags missing their value
     */
    public static AppConfig fromArgs(String[] args) {
        String mode = "pairs";
        Path tracks = null;
        String playlist = null;
        Path plan = null;
        String cutoff = null;
        Path store = Paths.get(Utils.envOrProp("PAIRS_STORE_PATH", DEFAULT_STORE));
        Path outDir = Paths.get(Utils.envOrProp("PAIRS_OUTPUT_DIR", DEFAULT_OUTPUT_DIR));
        Path input = null;
        Path output = null;
        boolean help = false;

        String[] argv = args == null ? new String[0] : args;
        int i = 0;
        if (argv.length > 0 && !argv[0].startsWith("-")) {
            mode = argv[0].trim().toLowerCase();
            i = 1;
        }
        for (; i < argv.length; i++) {
            switch (argv[i]) {
                case "--help", "-h" -> help = true;
                case "--tracks", "-t" -> tracks = Paths.get(valueAt(argv, i++));
                case "--playlist", "-l" -> playlist = valueAt(argv, i++);
                case "--plan", "-p" -> plan = Paths.get(valueAt(argv, i++));
                case "--cutoff", "-c" -> cutoff = valueAt(argv, i++);
                case "--store", "-s" -> store = Paths.get(valueAt(argv, i++));
                case "--out-dir", "-o" -> outDir = Paths.get(valueAt(argv, i++));
                case "--input", "-i" -> input = Paths.get(valueAt(argv, i++));
                case "--output" -> output = Paths.get(valueAt(argv, i++));
                default -> throw new IllegalArgumentException("Unknown argument: " + argv[i]);
            }
        }

        return new AppConfig(
            mode, tracks, playlist, plan, cutoff, store, outDir, input, output,
            Utils.envOrProp("SPOTIFY_CLIENT_ID", null),
            Utils.envOrProp("SPOTIFY_CLIENT_SECRET", null),
            help
        );
    }

    private static String valueAt(String[] args, int flagIndex) {
        if (flagIndex + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[flagIndex]);
        }
        return args[flagIndex + 1];
    }

    public static String usage() {
        return String.join("\n",
            "Usage: sample-pairs [pairs|import|enrich] [options]",
            "  pairs   --tracks <tracks.json> | --playlist <url>  [--plan <plan.json>] [--cutoff <n>]",
            "          [--store <pairs.enriched.json>] [--out-dir <dir>]",
            "  import  --input <export.json> [--store <pairs.enriched.json>]",
            "  enrich  --input <pairs.txt> --output <pairs.json>",
            "  --help, -h   show this help");
    }
}
