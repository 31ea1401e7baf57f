package com.raditha.treeflat.config;

import com.raditha.treeflat.model.AstNode;

/**
 * The four detail level axes. Each axis only ever touches its own fields, so
 * changing one never alters what another produces.
 *
 * @param context   classification detail
 * @param source    location detail
 * @param structure tree structure detail
 * @param preview   preview text detail
 */
public record ExtractionConfig(
        ContextLevel context,
        SourceLevel source,
        StructureLevel structure,
        PreviewSetting preview) {

    public ExtractionConfig {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (structure == null) {
            throw new IllegalArgumentException("structure cannot be null");
        }
        if (preview == null) {
            throw new IllegalArgumentException("preview cannot be null");
        }
    }

    /**
     * native context, line level source, full structure and smart previews.
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(ContextLevel.NATIVE, SourceLevel.LINES, StructureLevel.FULL, PreviewSetting.smart());
    }

    /**
     * Everything switched on, previews untruncated.
     */
    public static ExtractionConfig full() {
        return new ExtractionConfig(ContextLevel.NATIVE, SourceLevel.FULL, StructureLevel.FULL, PreviewSetting.full());
    }

    /**
     * Validates all four axes. Axes are checked in the order context, source,
     * structure, preview and the first invalid one is reported.
     *
     * @throws InvalidParameterException for the first value outside its accepted set
     */
    public static ExtractionConfig parse(String context, String source, String structure, String preview) {
        return new ExtractionConfig(
                ContextLevel.parse(context),
                SourceLevel.parse(source),
                StructureLevel.parse(structure),
                PreviewSetting.parse(preview));
    }

    public ExtractionConfig withContext(ContextLevel level) {
        return new ExtractionConfig(level, source, structure, preview);
    }

    public ExtractionConfig withSource(SourceLevel level) {
        return new ExtractionConfig(context, level, structure, preview);
    }

    public ExtractionConfig withStructure(StructureLevel level) {
        return new ExtractionConfig(context, source, level, preview);
    }

    public ExtractionConfig withPreview(PreviewSetting setting) {
        return new ExtractionConfig(context, source, structure, setting);
    }

    /**
     * Nulls every field the configured levels exclude. The id, raw type and
     * language are always kept.
     */
    public AstNode project(AstNode node) {
        boolean types = context.includesSemanticType();
        boolean names = context.includesName();
        boolean lines = source.includesLines();
        boolean columns = source.includesColumns();
        boolean parents = structure.includesParent();
        boolean counts = structure.includesCounts();

        return new AstNode(
                node.id(),
                node.rawType(),
                types ? node.normalizedType() : null,
                names ? node.name() : null,
                types ? node.semanticType() : null,
                types ? node.flags() : null,
                source.includesPath() ? node.filePath() : null,
                node.language(),
                lines ? node.startLine() : null,
                columns ? node.startColumn() : null,
                lines ? node.endLine() : null,
                columns ? node.endColumn() : null,
                parents ? node.parentId() : null,
                parents ? node.depth() : null,
                counts ? node.siblingIndex() : null,
                counts ? node.childrenCount() : null,
                counts ? node.descendantCount() : null,
                preview.enabled() ? node.preview() : null,
                context.includesNative() ? node.nativeContext() : null);
    }
}
