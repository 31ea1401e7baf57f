package com.raditha.treeflat.taxonomy;

import java.util.Optional;

/**
 * Broadest level of the semantic taxonomy, held in the two high bits of a
 * semantic type code.
 */
public enum SuperKind {
    /** Values, names, patterns and types */
    DATA_STRUCTURE(0x00),

    /** Operators, calls, transformations and definitions */
    COMPUTATION(0x40),

    /** Statements, control flow and error handling */
    CONTROL_EFFECTS(0x80),

    /** Comments, annotations, imports and parser artefacts */
    META_EXTERNAL(0xC0);

    public static final int MASK = 0xC0;

    private final int code;

    SuperKind(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Finds the super kind owning a semantic type code.
     *
     * @param code semantic type code in the range 0..255
     * @return the super kind, or empty when the code is outside the byte range
     */
    public static Optional<SuperKind> of(int code) {
        if (code < 0 || code > 0xFF) {
            return Optional.empty();
        }
        int bits = code & MASK;
        for (SuperKind superKind : values()) {
            if (superKind.code == bits) {
                return Optional.of(superKind);
            }
        }
        return Optional.empty();
    }
}
