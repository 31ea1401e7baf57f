package com.raditha.treeflat.flatten;

import com.raditha.treeflat.config.ExtractionConfig;
import com.raditha.treeflat.extraction.ExtractionEngine;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.language.LanguageAdapter;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.registry.NativeStrategy;
import com.raditha.treeflat.registry.NodeConfig;
import com.raditha.treeflat.registry.NodeConfigRegistry;
import com.raditha.treeflat.registry.NodeFlags;
import com.raditha.treeflat.taxonomy.SemanticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns one parse tree into node records.
 * <p>
 * The first pass is an iterative pre-order walk that gives every node the next
 * id along with its parent, depth and sibling index, and extracts names, previews
 * and native detail while the front end's handles are still valid. The second pass
 * visits the arena deepest level first and folds children and descendant counts
 * into each parent. Neither pass recurses, so tree depth is bounded only by memory.
 * <p>
 * Ids start at 0 for the root; callers concatenating units shift them.
 */
public class TreeFlattener {

    private static final Logger logger = LoggerFactory.getLogger(TreeFlattener.class);

    private final LanguageAdapter adapter;
    private final NodeConfigRegistry registry;
    private final ExtractionConfig config;
    private final ExtractionEngine engine;

    public TreeFlattener(LanguageAdapter adapter, NodeConfigRegistry registry, ExtractionConfig config) {
        this.adapter = adapter;
        this.registry = registry;
        this.config = config;
        this.engine = new ExtractionEngine(adapter);
    }

    /**
     * Flattens a tree.
     *
     * @param root     root of the parse tree, or {@code null} for a unit without one
     * @param filePath path recorded on every node, may be {@code null}
     * @return records in id order
     * @throws NodeExtractionException     if an extractor fails
     * @throws FlatteningInvariantException if the arena is structurally inconsistent
     */
    public List<AstNode> flatten(SyntaxNode root, String filePath) {
        if (root == null) {
            return List.of();
        }
        List<FlatEntry> arena = assignIds(root);
        foldCounts(arena);
        InvariantChecker.check(arena);
        logger.debug("Flattened {} nodes of {}", arena.size(), filePath);
        return toRecords(arena, filePath);
    }

    private record Pending(SyntaxNode node, int parent, int depth, int siblingIndex) {
    }

    /**
     * Pass 1: pre-order walk with an explicit stack.
     */
    private List<FlatEntry> assignIds(SyntaxNode root) {
        List<FlatEntry> arena = new ArrayList<>();
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, -1, 0, 0));

        while (!stack.isEmpty()) {
            Pending current = stack.pop();
            int id = arena.size();
            arena.add(entryFor(current));

            SyntaxNode node = current.node();
            for (int i = node.childCount() - 1; i >= 0; i--) {
                stack.push(new Pending(node.child(i), id, current.depth() + 1, i));
            }
        }
        return arena;
    }

    private FlatEntry entryFor(Pending pending) {
        SyntaxNode node = pending.node();
        String rawType = node.rawType();
        NodeConfig nodeConfig = registry.lookup(adapter.name(), rawType).orElseGet(NodeConfig::opaque);

        String name = null;
        String preview = null;
        NativeContext nativeContext = null;
        try {
            if (config.context().includesName()) {
                name = engine.extractName(node, nodeConfig.nameStrategy());
            }
            if (config.preview().enabled()) {
                preview = engine.extractPreview(node, nodeConfig.previewStrategy(), config.preview());
            }
            if (config.context().includesNative() && nodeConfig.nativeStrategy() != NativeStrategy.NONE) {
                nativeContext = engine.extractNative(node, nodeConfig.nativeStrategy());
            }
        } catch (RuntimeException e) {
            throw new NodeExtractionException(rawType, node.startLine(), e);
        }

        boolean positioned = node.hasPosition();
        return new FlatEntry(
                rawType,
                nodeConfig,
                pending.parent(),
                pending.depth(),
                pending.siblingIndex(),
                positioned ? node.startLine() : 0,
                positioned ? node.startColumn() : 0,
                positioned ? node.endLine() : 0,
                positioned ? node.endColumn() : 0,
                name == null || name.isEmpty() ? null : name,
                preview,
                nativeContext);
    }

    /**
     * Pass 2: deepest level first, every node adds itself and its descendants to
     * its parent. All children of a node sit one level deeper, so they are complete
     * before the node itself is read.
     */
    static void foldCounts(List<FlatEntry> arena) {
        int maxDepth = 0;
        for (FlatEntry entry : arena) {
            maxDepth = Math.max(maxDepth, entry.depth);
        }
        List<List<Integer>> levels = new ArrayList<>(maxDepth + 1);
        for (int d = 0; d <= maxDepth; d++) {
            levels.add(new ArrayList<>());
        }
        for (int id = 0; id < arena.size(); id++) {
            levels.get(arena.get(id).depth).add(id);
        }

        for (int d = maxDepth; d > 0; d--) {
            for (int id : levels.get(d)) {
                FlatEntry entry = arena.get(id);
                FlatEntry parent = arena.get(entry.parent);
                parent.childrenCount++;
                parent.descendantCount += 1 + entry.descendantCount;
            }
        }
    }

    private List<AstNode> toRecords(List<FlatEntry> arena, String filePath) {
        List<AstNode> records = new ArrayList<>(arena.size());
        for (int id = 0; id < arena.size(); id++) {
            FlatEntry entry = arena.get(id);
            int code = entry.config.semanticType();
            AstNode full = new AstNode(
                    id,
                    entry.rawType,
                    SemanticType.of(code).map(Enum::name).orElse(null),
                    entry.name,
                    code,
                    NodeFlags.resolve(entry.config.flags(), entry.childrenCount),
                    filePath,
                    adapter.name(),
                    positive(entry.startLine),
                    positive(entry.startColumn),
                    positive(entry.endLine),
                    positive(entry.endColumn),
                    entry.parent < 0 ? null : (long) entry.parent,
                    entry.depth,
                    entry.siblingIndex,
                    entry.childrenCount,
                    entry.descendantCount,
                    entry.preview,
                    entry.nativeContext);
            records.add(config.project(full));
        }
        return records;
    }

    private static Integer positive(int value) {
        return value > 0 ? value : null;
    }
}
