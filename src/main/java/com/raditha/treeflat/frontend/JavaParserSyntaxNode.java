package com.raditha.treeflat.frontend;

import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Wraps a JavaParser {@link Node}. The raw type is the node's class name.
 * <p>
 * JavaParser keeps child nodes in insertion order rather than source order, so
 * children are sorted by their begin position. Nodes without a range sort last,
 * keeping their relative order.
 */
public final class JavaParserSyntaxNode implements SyntaxNode {

    private static final Comparator<Node> SOURCE_ORDER = Comparator.comparing(
            (Node n) -> n.getBegin().orElse(null),
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final Node node;
    private final JavaParserSyntaxNode parent;
    private List<Node> children;

    JavaParserSyntaxNode(Node node, JavaParserSyntaxNode parent) {
        this.node = node;
        this.parent = parent;
    }

    /**
     * The wrapped JavaParser node, for Java specific extractors.
     */
    public Node node() {
        return node;
    }

    private List<Node> sortedChildren() {
        if (children == null) {
            List<Node> sorted = new ArrayList<>(node.getChildNodes());
            sorted.sort(SOURCE_ORDER);
            children = sorted;
        }
        return children;
    }

    @Override
    public String rawType() {
        return node.getClass().getSimpleName();
    }

    @Override
    public int childCount() {
        return sortedChildren().size();
    }

    @Override
    public SyntaxNode child(int index) {
        return new JavaParserSyntaxNode(sortedChildren().get(index), this);
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public boolean isNamed() {
        return true;
    }

    @Override
    public String text() {
        return node.getTokenRange().map(TokenRange::toString).orElse("");
    }

    @Override
    public int startLine() {
        return node.getRange().map(r -> r.begin.line).orElse(0);
    }

    @Override
    public int startColumn() {
        return node.getRange().map(r -> r.begin.column).orElse(0);
    }

    @Override
    public int endLine() {
        return node.getRange().map(r -> r.end.line).orElse(0);
    }

    @Override
    public int endColumn() {
        // JavaParser ranges are inclusive, records use an exclusive end
        return node.getRange().map(r -> r.end.column + 1).orElse(0);
    }

    /**
     * Finds the direct child of a given JavaParser type, the closest thing Java
     * nodes have to a grammar field.
     */
    @Override
    public Optional<SyntaxNode> childByField(String field) {
        List<Node> sorted = sortedChildren();
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).getClass().getSimpleName().equals(field)) {
                return Optional.of(child(i));
            }
        }
        return Optional.empty();
    }
}
