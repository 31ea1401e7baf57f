package com.raditha.treeflat.model;

import com.raditha.treeflat.taxonomy.SemanticTypes;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Combined record stream of one read, with the per unit outcomes.
 */
public record AstResultSet(List<AstNode> nodes, List<UnitSummary> units) {

    public AstResultSet {
        nodes = List.copyOf(nodes);
        units = List.copyOf(units);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int maxDepth() {
        return nodes.stream()
                .map(AstNode::depth)
                .filter(Objects::nonNull)
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);
    }

    public Set<String> languages() {
        Set<String> languages = new LinkedHashSet<>();
        for (AstNode node : nodes) {
            if (node.language() != null) {
                languages.add(node.language());
            }
        }
        return languages;
    }

    /**
     * Number of error nodes in the stream.
     */
    public long errorCount() {
        return nodes.stream()
                .filter(n -> n.semanticType() != null && SemanticTypes.isError(n.semanticType()))
                .count();
    }

    public List<AstNode> nodesOf(String filePath) {
        return nodes.stream().filter(n -> Objects.equals(filePath, n.filePath())).toList();
    }
}
