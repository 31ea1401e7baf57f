package com.raditha.treeflat.flatten;

import com.raditha.treeflat.config.ContextLevel;
import com.raditha.treeflat.config.ExtractionConfig;
import com.raditha.treeflat.config.PreviewSetting;
import com.raditha.treeflat.config.SourceLevel;
import com.raditha.treeflat.config.StructureLevel;
import com.raditha.treeflat.frontend.FakeSyntaxNode;
import com.raditha.treeflat.language.FakeLanguageAdapter;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.registry.NameStrategy;
import com.raditha.treeflat.registry.NativeStrategy;
import com.raditha.treeflat.registry.NodeConfig;
import com.raditha.treeflat.registry.NodeConfigRegistry;
import com.raditha.treeflat.registry.NodeFlags;
import com.raditha.treeflat.registry.PreviewStrategy;
import com.raditha.treeflat.taxonomy.SemanticType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.raditha.treeflat.frontend.FakeSyntaxNode.node;
import static com.raditha.treeflat.frontend.FakeSyntaxNode.token;
import static org.junit.jupiter.api.Assertions.*;

class TreeFlattenerTest {

    static final NodeConfigRegistry REGISTRY = NodeConfigRegistry.of(Map.of("fake", Map.of(
            "module", new NodeConfig(SemanticType.DEFINITION_MODULE, NameStrategy.NONE),
            "function_definition", new NodeConfig(SemanticType.DEFINITION_FUNCTION.code(), NameStrategy.FIND_IDENTIFIER,
                    PreviewStrategy.SIGNATURE, NativeStrategy.NONE, NodeFlags.EMBODIED),
            "identifier", new NodeConfig(SemanticType.NAME_IDENTIFIER, NameStrategy.FULL_TEXT),
            "block", new NodeConfig(SemanticType.ORGANIZATION_BLOCK, NameStrategy.NONE),
            "pass_statement", new NodeConfig(SemanticType.EXECUTION_STATEMENT.code(), NameStrategy.NONE,
                    PreviewStrategy.DEFAULT, NativeStrategy.NONE, NodeFlags.KEYWORD),
            "def", new NodeConfig(SemanticType.NAME_KEYWORD.code(), NameStrategy.NONE,
                    PreviewStrategy.DEFAULT, NativeStrategy.NONE, NodeFlags.KEYWORD_IF_LEAF),
            "broken", new NodeConfig(SemanticType.NAME_IDENTIFIER, NameStrategy.CUSTOM))));

    private FakeLanguageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FakeLanguageAdapter();
    }

    /** module > function_definition > (def, identifier, ":", block > pass_statement) */
    static FakeSyntaxNode helloTree() {
        return node("module", "def hello(): pass",
                node("function_definition", "def hello(): pass",
                        token("def").at(1, 1, 1, 4),
                        node("identifier", "hello").at(1, 5, 1, 10),
                        node("parameters", "()").at(1, 10, 1, 12),
                        token(":").at(1, 12, 1, 13),
                        node("block", "pass",
                                node("pass_statement", "pass").at(1, 14, 1, 18)).at(1, 14, 1, 18)
                ).at(1, 1, 1, 18)
        ).at(1, 1, 1, 18);
    }

    private List<AstNode> flatten(FakeSyntaxNode root, ExtractionConfig config) {
        return new TreeFlattener(adapter, REGISTRY, config).flatten(root, "hello.fake");
    }

    @Test
    void testPreOrderIdsAndStructure() {
        List<AstNode> nodes = flatten(helloTree(), ExtractionConfig.full());

        assertEquals(8, nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(i, nodes.get(i).id());
        }
        assertEquals(List.of("module", "function_definition", "def", "identifier", "parameters", ":", "block",
                "pass_statement"), nodes.stream().map(AstNode::rawType).toList());

        AstNode root = nodes.get(0);
        assertTrue(root.isRoot());
        assertEquals(0, root.depth());
        assertEquals(1, root.childrenCount());
        assertEquals(7, root.descendantCount());

        AstNode function = nodes.get(1);
        assertEquals(0L, function.parentId());
        assertEquals(1, function.depth());
        assertEquals(5, function.childrenCount());
        assertEquals(6, function.descendantCount());

        AstNode pass = nodes.get(7);
        assertEquals(6L, pass.parentId());
        assertEquals(3, pass.depth());
        assertEquals(0, pass.siblingIndex());
        assertEquals(0, pass.descendantCount());

        AstNode block = nodes.get(6);
        assertEquals(4, block.siblingIndex());
    }

    @Test
    void testClassificationAndNames() {
        List<AstNode> nodes = flatten(helloTree(), ExtractionConfig.full());

        AstNode function = nodes.get(1);
        assertEquals("DEFINITION_FUNCTION", function.normalizedType());
        assertEquals(SemanticType.DEFINITION_FUNCTION.code(), function.semanticType());
        assertEquals("hello", function.name());
        assertEquals(NodeFlags.EMBODIED, function.flags());
        assertEquals("def hello(): pass", function.preview());

        AstNode unmapped = nodes.get(4);
        assertEquals("PARSER_CONSTRUCT", unmapped.normalizedType());
        assertNull(unmapped.name(), "empty names are stored as null");

        assertEquals(NodeFlags.KEYWORD, nodes.get(2).flags(), "leaf keyword");
        assertEquals("fake", function.language());
        assertEquals("hello.fake", function.filePath());
    }

    @Test
    void testPositions() {
        List<AstNode> nodes = flatten(helloTree(), ExtractionConfig.full());
        AstNode identifier = nodes.get(3);
        assertEquals(1, identifier.startLine());
        assertEquals(5, identifier.startColumn());
        assertEquals(1, identifier.endLine());
        assertEquals(10, identifier.endColumn());
    }

    @Test
    void testNodesWithoutPositionReportNull() {
        List<AstNode> nodes = flatten(node("module", "", node("identifier", "x")), ExtractionConfig.full());
        assertNull(nodes.get(1).startLine());
        assertNull(nodes.get(1).endColumn());
    }

    @Test
    void testKeywordIfLeafIsDroppedOnInnerNodes() {
        FakeSyntaxNode root = node("module", "def", node("def", "def x", node("identifier", "x")));
        List<AstNode> nodes = flatten(root, ExtractionConfig.full());
        assertEquals(0, nodes.get(1).flags());
    }

    @Test
    void testNullRootIsEmpty() {
        assertTrue(flatten(null, ExtractionConfig.full()).isEmpty());
    }

    @Test
    void testSingleNode() {
        List<AstNode> nodes = flatten(node("module", ""), ExtractionConfig.full());
        assertEquals(1, nodes.size());
        assertEquals(0, nodes.get(0).descendantCount());
        assertEquals(0, nodes.get(0).childrenCount());
        assertNull(nodes.get(0).parentId());
    }

    @Test
    void testDeepTreeDoesNotOverflowTheStack() {
        int depth = 200_000;
        FakeSyntaxNode root = node("module", "x");
        FakeSyntaxNode current = root;
        for (int i = 0; i < depth; i++) {
            FakeSyntaxNode next = node("nested", "x");
            current.add(next);
            current = next;
        }

        List<AstNode> nodes = flatten(root, ExtractionConfig.full());

        assertEquals(depth + 1, nodes.size());
        assertEquals(depth, nodes.get(0).descendantCount());
        assertEquals(depth, nodes.get(depth).depth());
        assertEquals(depth - 1L, nodes.get(depth).parentId());
    }

    @Test
    void testWideTree() {
        FakeSyntaxNode root = node("module", "");
        for (int i = 0; i < 10_000; i++) {
            root.add(node("identifier", "v" + i));
        }
        List<AstNode> nodes = flatten(root, ExtractionConfig.full());
        assertEquals(10_000, nodes.get(0).childrenCount());
        assertEquals(9_999, nodes.get(10_000).siblingIndex());
        assertEquals("v9999", nodes.get(10_000).name());
    }

    @Test
    void testExtractorFailureIsReportedWithTheNode() {
        adapter.withCustom("broken", n -> {
            throw new IllegalStateException("boom");
        });
        FakeSyntaxNode root = node("module", "", node("broken", "b").at(3, 1, 3, 2));

        NodeExtractionException e = assertThrows(NodeExtractionException.class,
                () -> flatten(root, ExtractionConfig.full()));
        assertTrue(e.getMessage().contains("broken"));
        assertTrue(e.getMessage().contains("line 3"));
        assertTrue(e.getMessage().contains("boom"));
    }

    @Test
    void testDisabledExtractionSkipsExtractors() {
        adapter.withCustom("broken", n -> {
            throw new IllegalStateException("never called");
        });
        FakeSyntaxNode root = node("module", "", node("broken", "b"));
        ExtractionConfig config = ExtractionConfig.full()
                .withContext(ContextLevel.NODE_TYPES_ONLY)
                .withPreview(PreviewSetting.none());

        List<AstNode> nodes = flatten(root, config);
        assertNull(nodes.get(1).name());
        assertEquals("NAME_IDENTIFIER", nodes.get(1).normalizedType());
    }

    @Test
    void testAxesDoNotChangeTheTreeShape() {
        ExtractionConfig minimal = new ExtractionConfig(ContextLevel.NONE, SourceLevel.NONE,
                StructureLevel.NONE, PreviewSetting.none());
        List<AstNode> full = flatten(helloTree(), ExtractionConfig.full());
        List<AstNode> bare = flatten(helloTree(), minimal);

        assertEquals(full.size(), bare.size());
        for (int i = 0; i < full.size(); i++) {
            assertEquals(full.get(i).id(), bare.get(i).id());
            assertEquals(full.get(i).rawType(), bare.get(i).rawType());
            assertNull(bare.get(i).parentId());
            assertNull(bare.get(i).semanticType());
            assertNull(bare.get(i).filePath());
            assertNull(bare.get(i).preview());
        }
    }

    @Test
    void testRepeatedFlatteningIsStable() {
        List<AstNode> first = flatten(helloTree(), ExtractionConfig.full());
        for (int i = 0; i < 10; i++) {
            assertEquals(first, flatten(helloTree(), ExtractionConfig.full()));
        }
    }
}
