package com.raditha.treeflat.cli;

/**
 * Format of the node table written by the command line.
 */
public enum OutputFormat {
    CSV,
    JSON;

    /**
     * Parse a format from its command line spelling, ignoring case.
     *
     * @throws IllegalArgumentException if the value is not a known format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "csv" -> CSV;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: csv or json");
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
