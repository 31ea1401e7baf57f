package com.raditha.treeflat.frontend;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.function.Supplier;

/**
 * Front end backed by a tree-sitter grammar. Each instance owns its own
 * {@link TSParser}.
 */
public class TreeSitterFrontEnd implements SyntaxFrontEnd {

    private final String languageName;
    private TSParser parser;

    public TreeSitterFrontEnd(String languageName, Supplier<TSLanguage> grammar) {
        this.languageName = languageName;
        this.parser = new TSParser();
        this.parser.setLanguage(grammar.get());
    }

    @Override
    public SyntaxNode parse(String source) throws SourceParseException {
        if (parser == null) {
            throw new IllegalStateException("Front end for " + languageName + " is closed");
        }
        TSTree tree;
        try {
            tree = parser.parseString(null, source);
        } catch (RuntimeException e) {
            throw new SourceParseException("tree-sitter failed to parse " + languageName + " source: " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new SourceParseException("tree-sitter returned no tree for " + languageName + " source");
        }
        return new TreeSitterSyntaxNode(tree, tree.getRootNode(), new SourceText(source), null);
    }

    @Override
    public void close() {
        // native memory is released by the binding's cleaner once unreachable
        parser = null;
    }
}
