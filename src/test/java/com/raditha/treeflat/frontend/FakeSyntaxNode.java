package com.raditha.treeflat.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hand built syntax node for tests that should not depend on a real grammar.
 */
public class FakeSyntaxNode implements SyntaxNode {

    private final String rawType;
    private final String text;
    private final List<FakeSyntaxNode> children = new ArrayList<>();
    private final Map<String, FakeSyntaxNode> fields = new HashMap<>();
    private FakeSyntaxNode parent;
    private boolean named = true;
    private int startLine;
    private int startColumn;
    private int endLine;
    private int endColumn;

    public FakeSyntaxNode(String rawType, String text) {
        this.rawType = rawType;
        this.text = text;
    }

    public static FakeSyntaxNode node(String rawType, String text, FakeSyntaxNode... children) {
        FakeSyntaxNode node = new FakeSyntaxNode(rawType, text);
        for (FakeSyntaxNode child : children) {
            node.add(child);
        }
        return node;
    }

    /** Anonymous token such as a keyword or punctuation. */
    public static FakeSyntaxNode token(String text) {
        FakeSyntaxNode node = new FakeSyntaxNode(text, text);
        node.named = false;
        return node;
    }

    public FakeSyntaxNode add(FakeSyntaxNode child) {
        child.parent = this;
        children.add(child);
        return this;
    }

    public FakeSyntaxNode field(String name, FakeSyntaxNode child) {
        add(child);
        fields.put(name, child);
        return this;
    }

    public FakeSyntaxNode at(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        return this;
    }

    @Override
    public String rawType() {
        return rawType;
    }

    @Override
    public int childCount() {
        return children.size();
    }

    @Override
    public SyntaxNode child(int index) {
        return children.get(index);
    }

    @Override
    public SyntaxNode parent() {
        return parent;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int startLine() {
        return startLine;
    }

    @Override
    public int startColumn() {
        return startColumn;
    }

    @Override
    public int endLine() {
        return endLine;
    }

    @Override
    public int endColumn() {
        return endColumn;
    }

    @Override
    public Optional<SyntaxNode> childByField(String field) {
        return Optional.ofNullable(fields.get(field));
    }
}
