package com.raditha.treeflat.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read only view of one node of a grammar front end's parse tree.
 * <p>
 * Implementations wrap engine handles that are only valid while the owning
 * {@link SyntaxFrontEnd} is open. Nothing outside the flattening and extraction
 * step may hold on to a {@code SyntaxNode}.
 * <p>
 * Positions are 1-based. Nodes without source positions report 0 for all four.
 */
public interface SyntaxNode {

    /** Grammar specific type string, e.g. {@code function_definition} or {@code MethodDeclaration}. */
    String rawType();

    int childCount();

    SyntaxNode child(int index);

    /** Enclosing node, or {@code null} for the root. */
    SyntaxNode parent();

    /** False for anonymous tokens such as punctuation and keywords. */
    boolean isNamed();

    /** Verbatim source text covered by the node. */
    String text();

    int startLine();

    int startColumn();

    int endLine();

    int endColumn();

    default boolean hasPosition() {
        return startLine() > 0;
    }

    /**
     * Child bound to a grammar field, for grammars that name their fields.
     */
    default Optional<SyntaxNode> childByField(String field) {
        return Optional.empty();
    }

    default List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(childCount());
        for (int i = 0; i < childCount(); i++) {
            children.add(child(i));
        }
        return children;
    }

    default List<SyntaxNode> namedChildren() {
        List<SyntaxNode> named = new ArrayList<>();
        for (int i = 0; i < childCount(); i++) {
            SyntaxNode c = child(i);
            if (c.isNamed()) {
                named.add(c);
            }
        }
        return named;
    }
}
