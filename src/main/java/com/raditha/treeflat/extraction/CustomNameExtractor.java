package com.raditha.treeflat.extraction;

import com.raditha.treeflat.frontend.SyntaxNode;

/**
 * Language supplied name extraction for raw types whose registry entry uses the
 * CUSTOM strategy. Implementations may look at siblings and ancestors but must
 * depend on nothing except the tree: no fields, no I/O.
 */
@FunctionalInterface
public interface CustomNameExtractor {

    /**
     * @return the name, or an empty string when the node has none
     */
    String extract(SyntaxNode node);
}
