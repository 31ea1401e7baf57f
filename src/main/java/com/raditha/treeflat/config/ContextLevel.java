package com.raditha.treeflat.config;

/**
 * How much classification each record carries.
 */
public enum ContextLevel {
    /** Raw type only */
    NONE("none"),
    /** Semantic type, normalized type and flags */
    NODE_TYPES_ONLY("node_types_only"),
    /** Adds the extracted name */
    NORMALIZED("normalized"),
    /** Adds the language specific native context */
    NATIVE("native");

    private final String parameterValue;

    ContextLevel(String parameterValue) {
        this.parameterValue = parameterValue;
    }

    public String parameterValue() {
        return parameterValue;
    }

    public boolean includesSemanticType() {
        return this != NONE;
    }

    public boolean includesName() {
        return this == NORMALIZED || this == NATIVE;
    }

    public boolean includesNative() {
        return this == NATIVE;
    }

    public static ContextLevel parse(String value) {
        return Parameters.parseEnum(Parameters.CONTEXT, value, values(), ContextLevel::parameterValue);
    }
}
