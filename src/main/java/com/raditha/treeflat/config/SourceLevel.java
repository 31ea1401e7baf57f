package com.raditha.treeflat.config;

/**
 * Which source location fields each record carries.
 */
public enum SourceLevel {
    NONE("none"),
    PATH("path"),
    LINES_ONLY("lines_only"),
    /** Path plus start and end lines */
    LINES("lines"),
    /** Path, lines and columns */
    FULL("full");

    private final String parameterValue;

    SourceLevel(String parameterValue) {
        this.parameterValue = parameterValue;
    }

    public String parameterValue() {
        return parameterValue;
    }

    public boolean includesPath() {
        return this == PATH || this == LINES || this == FULL;
    }

    public boolean includesLines() {
        return this == LINES_ONLY || this == LINES || this == FULL;
    }

    public boolean includesColumns() {
        return this == FULL;
    }

    public static SourceLevel parse(String value) {
        return Parameters.parseEnum(Parameters.SOURCE, value, values(), SourceLevel::parameterValue);
    }
}
