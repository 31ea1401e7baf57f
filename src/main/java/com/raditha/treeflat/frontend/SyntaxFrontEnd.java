package com.raditha.treeflat.frontend;

import java.util.List;

/**
 * A parser instance scoped to one unit.
 * <p>
 * Front ends are created fresh for every unit and closed when the unit is done.
 * They are never shared between units or threads, and every method other than
 * {@link #close()} throws {@link IllegalStateException} once closed.
 */
public interface SyntaxFrontEnd extends AutoCloseable {

    /**
     * Parses a whole unit.
     *
     * @param source unit text, possibly empty
     * @return root of the parse tree
     * @throws SourceParseException when the grammar cannot produce a tree
     */
    SyntaxNode parse(String source) throws SourceParseException;

    /**
     * Problems the grammar recovered from during the last {@link #parse(String)}.
     * The tree it returned is still complete enough to flatten. Grammars that mark
     * errors inside the tree itself report nothing here.
     */
    default List<String> recoveredProblems() {
        return List.of();
    }

    @Override
    void close();
}
