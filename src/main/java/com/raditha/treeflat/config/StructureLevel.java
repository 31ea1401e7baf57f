package com.raditha.treeflat.config;

/**
 * Which tree structure fields each record carries.
 */
public enum StructureLevel {
    NONE("none"),
    /** Parent id and depth */
    MINIMAL("minimal"),
    /** Adds sibling index, children count and descendant count */
    FULL("full");

    private final String parameterValue;

    StructureLevel(String parameterValue) {
        this.parameterValue = parameterValue;
    }

    public String parameterValue() {
        return parameterValue;
    }

    public boolean includesParent() {
        return this != NONE;
    }

    public boolean includesCounts() {
        return this == FULL;
    }

    public static StructureLevel parse(String value) {
        return Parameters.parseEnum(Parameters.STRUCTURE, value, values(), StructureLevel::parameterValue);
    }
}
