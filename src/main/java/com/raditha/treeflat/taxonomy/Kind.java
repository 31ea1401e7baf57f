package com.raditha.treeflat.taxonomy;

import java.util.Optional;

/**
 * Second level of the semantic taxonomy. Each super kind owns exactly four kinds
 * and the kind occupies the high nibble of a semantic type code.
 */
public enum Kind {
    LITERAL(0x00, SuperKind.DATA_STRUCTURE),
    NAME(0x10, SuperKind.DATA_STRUCTURE),
    PATTERN(0x20, SuperKind.DATA_STRUCTURE),
    TYPE(0x30, SuperKind.DATA_STRUCTURE),

    OPERATOR(0x40, SuperKind.COMPUTATION),
    COMPUTATION_NODE(0x50, SuperKind.COMPUTATION),
    TRANSFORM(0x60, SuperKind.COMPUTATION),
    DEFINITION(0x70, SuperKind.COMPUTATION),

    EXECUTION(0x80, SuperKind.CONTROL_EFFECTS),
    FLOW_CONTROL(0x90, SuperKind.CONTROL_EFFECTS),
    ERROR_HANDLING(0xA0, SuperKind.CONTROL_EFFECTS),
    ORGANIZATION(0xB0, SuperKind.CONTROL_EFFECTS),

    METADATA(0xC0, SuperKind.META_EXTERNAL),
    EXTERNAL(0xD0, SuperKind.META_EXTERNAL),
    PARSER_SPECIFIC(0xE0, SuperKind.META_EXTERNAL),

    /** Holds the parse error type and room for future additions */
    RESERVED(0xF0, SuperKind.META_EXTERNAL);

    public static final int MASK = 0xF0;

    private static final Kind[] BY_NIBBLE = new Kind[16];

    static {
        for (Kind kind : values()) {
            BY_NIBBLE[kind.code >> 4] = kind;
        }
    }

    private final int code;
    private final SuperKind superKind;

    Kind(int code, SuperKind superKind) {
        this.code = code;
        this.superKind = superKind;
    }

    public int code() {
        return code;
    }

    public SuperKind superKind() {
        return superKind;
    }

    public static Optional<Kind> of(int code) {
        if (code < 0 || code > 0xFF) {
            return Optional.empty();
        }
        return Optional.of(BY_NIBBLE[(code & MASK) >> 4]);
    }
}
