package com.samplepairs.app;

/**
 * Utility class for small helpers shared by the command-line glue.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public final class Utils {

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Reads a setting from the environment, then from system properties, then falls back to a default.
     * @param key Variable / property name
     * @param defaultVal Value used when neither is set
     * @return resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }
}
