package com.raditha.treeflat.registry;

import com.raditha.treeflat.taxonomy.SemanticType;

/**
 * Classification and extraction directives for one raw node type.
 *
 * @param semanticType    semantic type code, variant bits included
 * @param nameStrategy    how the node's name is found
 * @param previewStrategy how smart previews are shortened
 * @param nativeStrategy  language specific detail collected at the native context level
 * @param flags           {@link NodeFlags} bitset
 */
public record NodeConfig(
        int semanticType,
        NameStrategy nameStrategy,
        PreviewStrategy previewStrategy,
        NativeStrategy nativeStrategy,
        int flags) {

    public NodeConfig {
        if (semanticType < 0 || semanticType > 0xFF) {
            throw new IllegalArgumentException("semanticType must be between 0 and 255");
        }
        if (nameStrategy == null) {
            nameStrategy = NameStrategy.NONE;
        }
        if (previewStrategy == null) {
            previewStrategy = PreviewStrategy.DEFAULT;
        }
        if (nativeStrategy == null) {
            nativeStrategy = NativeStrategy.NONE;
        }
    }

    public NodeConfig(SemanticType type, NameStrategy nameStrategy) {
        this(type.code(), nameStrategy, PreviewStrategy.DEFAULT, NativeStrategy.NONE, 0);
    }

    /**
     * Configuration applied to raw types the language table does not know.
     */
    public static NodeConfig opaque() {
        return new NodeConfig(SemanticType.PARSER_CONSTRUCT, NameStrategy.NONE);
    }

    public boolean hasFlag(int flag) {
        return (flags & flag) != 0;
    }
}
