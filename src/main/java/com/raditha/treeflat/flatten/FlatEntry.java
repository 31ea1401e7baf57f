package com.raditha.treeflat.flatten;

import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.registry.NodeConfig;

/**
 * Arena slot for one node. Everything except the two counters is written once in
 * the pre-order pass; the counters are folded in by the bottom-up pass.
 */
final class FlatEntry {
    final String rawType;
    final NodeConfig config;
    final int parent;
    final int depth;
    final int siblingIndex;
    final int startLine;
    final int startColumn;
    final int endLine;
    final int endColumn;
    final String name;
    final String preview;
    final NativeContext nativeContext;

    int childrenCount;
    int descendantCount;

    FlatEntry(String rawType, NodeConfig config, int parent, int depth, int siblingIndex,
              int startLine, int startColumn, int endLine, int endColumn,
              String name, String preview, NativeContext nativeContext) {
        this.rawType = rawType;
        this.config = config;
        this.parent = parent;
        this.depth = depth;
        this.siblingIndex = siblingIndex;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.name = name;
        this.preview = preview;
        this.nativeContext = nativeContext;
    }
}
