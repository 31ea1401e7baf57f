package com.raditha.treeflat.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bit flags carried on every node record.
 */
public class NodeFlags {
    public static final int KEYWORD = 0x01;
    /** The node has a body (function, class, loop) */
    public static final int EMBODIED = 0x02;
    public static final int DECLARATION_ONLY = 0x04;
    public static final int PUBLIC = 0x08;
    /**
     * Registry directive only. Resolved while flattening into {@link #KEYWORD} for
     * leaves and dropped for nodes with children, so it never reaches a record.
     */
    public static final int KEYWORD_IF_LEAF = 0x10;

    private static final Map<String, Integer> BY_NAME = new LinkedHashMap<>();

    static {
        BY_NAME.put("KEYWORD", KEYWORD);
        BY_NAME.put("EMBODIED", EMBODIED);
        BY_NAME.put("DECLARATION_ONLY", DECLARATION_ONLY);
        BY_NAME.put("PUBLIC", PUBLIC);
        BY_NAME.put("KEYWORD_IF_LEAF", KEYWORD_IF_LEAF);
    }

    private NodeFlags() {
        /* this is only a utility class */
    }

    /**
     * Combines flag names into a bitset.
     *
     * @throws IllegalArgumentException for an unknown flag name
     */
    public static int parse(Collection<String> names) {
        int flags = 0;
        for (String name : names) {
            Integer bit = BY_NAME.get(name.trim().toUpperCase(Locale.ROOT));
            if (bit == null) {
                throw new IllegalArgumentException("Unknown node flag '" + name
                        + "'. Valid values are: " + String.join(", ", BY_NAME.keySet()));
            }
            flags |= bit;
        }
        return flags;
    }

    /**
     * Resolves {@link #KEYWORD_IF_LEAF} against the node's child count.
     */
    public static int resolve(int flags, int childCount) {
        if ((flags & KEYWORD_IF_LEAF) == 0) {
            return flags;
        }
        int resolved = flags & ~KEYWORD_IF_LEAF;
        return childCount == 0 ? resolved | KEYWORD : resolved;
    }

    public static List<String> names(int flags) {
        List<String> names = new ArrayList<>();
        BY_NAME.forEach((name, bit) -> {
            if ((flags & bit) != 0) {
                names.add(name);
            }
        });
        return names;
    }
}
