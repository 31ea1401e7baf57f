package com.raditha.treeflat.frontend;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.util.Optional;

/**
 * Lazy wrapper over a {@link TSNode}. Keeps the owning tree reachable so the
 * native handle stays valid while the wrapper is in use.
 */
final class TreeSitterSyntaxNode implements SyntaxNode {

    private final TSTree tree;
    private final TSNode node;
    private final SourceText source;
    private final TreeSitterSyntaxNode parent;

    TreeSitterSyntaxNode(TSTree tree, TSNode node, SourceText source, TreeSitterSyntaxNode parent) {
        this.tree = tree;
        this.node = node;
        this.source = source;
        this.parent = parent;
    }

    @Override
    public String rawType() {
        return node.getType();
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public SyntaxNode child(int index) {
        return new TreeSitterSyntaxNode(tree, node.getChild(index), source, this);
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public String text() {
        return source.slice(node.getStartByte(), node.getEndByte());
    }

    @Override
    public int startLine() {
        return node.getStartPoint().getRow() + 1;
    }

    @Override
    public int startColumn() {
        return node.getStartPoint().getColumn() + 1;
    }

    @Override
    public int endLine() {
        return node.getEndPoint().getRow() + 1;
    }

    @Override
    public int endColumn() {
        return node.getEndPoint().getColumn() + 1;
    }

    @Override
    public Optional<SyntaxNode> childByField(String field) {
        TSNode found = node.getChildByFieldName(field);
        if (found == null || found.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new TreeSitterSyntaxNode(tree, found, source, this));
    }
}
