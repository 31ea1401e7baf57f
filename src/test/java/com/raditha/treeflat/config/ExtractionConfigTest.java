package com.raditha.treeflat.config;

import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.NativeContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigTest {

    private static final AstNode FULL_NODE = new AstNode(7, "function_definition", "DEFINITION_FUNCTION", "hello",
            0x70, 2, "a.py", "python", 1, 1, 3, 9, 0L, 1, 0, 4, 10, "def hello()",
            new NativeContext(null, List.of(new NativeContext.Parameter("x")), List.of(), null, "hello"));

    @Test
    void testFullKeepsEverything() {
        assertEquals(FULL_NODE, ExtractionConfig.full().project(FULL_NODE));
    }

    @Test
    void testContextLevels() {
        ExtractionConfig base = ExtractionConfig.full();

        AstNode none = base.withContext(ContextLevel.NONE).project(FULL_NODE);
        assertNull(none.semanticType());
        assertNull(none.normalizedType());
        assertNull(none.flags());
        assertNull(none.name());
        assertNull(none.nativeContext());
        assertEquals("function_definition", none.rawType());

        AstNode types = base.withContext(ContextLevel.NODE_TYPES_ONLY).project(FULL_NODE);
        assertEquals(0x70, types.semanticType());
        assertNull(types.name());

        AstNode normalized = base.withContext(ContextLevel.NORMALIZED).project(FULL_NODE);
        assertEquals("hello", normalized.name());
        assertNull(normalized.nativeContext());
    }

    @Test
    void testSourceLevels() {
        ExtractionConfig base = ExtractionConfig.full();

        AstNode none = base.withSource(SourceLevel.NONE).project(FULL_NODE);
        assertNull(none.filePath());
        assertNull(none.startLine());
        assertEquals("python", none.language(), "language is always kept");

        AstNode path = base.withSource(SourceLevel.PATH).project(FULL_NODE);
        assertEquals("a.py", path.filePath());
        assertNull(path.endLine());

        AstNode linesOnly = base.withSource(SourceLevel.LINES_ONLY).project(FULL_NODE);
        assertNull(linesOnly.filePath());
        assertEquals(1, linesOnly.startLine());
        assertEquals(3, linesOnly.endLine());
        assertNull(linesOnly.startColumn());

        AstNode lines = base.withSource(SourceLevel.LINES).project(FULL_NODE);
        assertEquals("a.py", lines.filePath());
        assertNull(lines.endColumn());

        assertEquals(9, base.withSource(SourceLevel.FULL).project(FULL_NODE).endColumn());
    }

    @Test
    void testStructureLevels() {
        ExtractionConfig base = ExtractionConfig.full();

        AstNode none = base.withStructure(StructureLevel.NONE).project(FULL_NODE);
        assertNull(none.parentId());
        assertNull(none.depth());
        assertNull(none.descendantCount());
        assertEquals(7, none.id());

        AstNode minimal = base.withStructure(StructureLevel.MINIMAL).project(FULL_NODE);
        assertEquals(0L, minimal.parentId());
        assertEquals(1, minimal.depth());
        assertNull(minimal.childrenCount());
        assertNull(minimal.siblingIndex());
    }

    @ParameterizedTest
    @EnumSource(ContextLevel.class)
    void testContextNeverTouchesOtherAxes(ContextLevel level) {
        AstNode node = ExtractionConfig.full().withContext(level).project(FULL_NODE);
        assertEquals(FULL_NODE.filePath(), node.filePath());
        assertEquals(FULL_NODE.startColumn(), node.startColumn());
        assertEquals(FULL_NODE.parentId(), node.parentId());
        assertEquals(FULL_NODE.descendantCount(), node.descendantCount());
        assertEquals(FULL_NODE.preview(), node.preview());
    }

    @ParameterizedTest
    @EnumSource(SourceLevel.class)
    void testSourceNeverTouchesOtherAxes(SourceLevel level) {
        AstNode node = ExtractionConfig.full().withSource(level).project(FULL_NODE);
        assertEquals(FULL_NODE.name(), node.name());
        assertEquals(FULL_NODE.semanticType(), node.semanticType());
        assertEquals(FULL_NODE.depth(), node.depth());
        assertEquals(FULL_NODE.preview(), node.preview());
    }

    @ParameterizedTest
    @EnumSource(StructureLevel.class)
    void testStructureNeverTouchesOtherAxes(StructureLevel level) {
        AstNode node = ExtractionConfig.full().withStructure(level).project(FULL_NODE);
        assertEquals(FULL_NODE.name(), node.name());
        assertEquals(FULL_NODE.filePath(), node.filePath());
        assertEquals(FULL_NODE.endLine(), node.endLine());
        assertEquals(FULL_NODE.nativeContext(), node.nativeContext());
    }

    @Test
    void testPreviewNone() {
        AstNode node = ExtractionConfig.full().withPreview(PreviewSetting.none()).project(FULL_NODE);
        assertNull(node.preview());
        assertEquals("hello", node.name());
    }

    @Test
    void testParse() {
        ExtractionConfig config = ExtractionConfig.parse("normalized", "path", "none", "none");
        assertEquals(ContextLevel.NORMALIZED, config.context());
        assertEquals(SourceLevel.PATH, config.source());
        assertEquals(StructureLevel.NONE, config.structure());
        assertFalse(config.preview().enabled());
    }
}
