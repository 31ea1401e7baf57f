package com.raditha.treeflat.flatten;

import java.util.List;

/**
 * Verifies the arena after both passes. Runs in linear time on every flatten.
 */
final class InvariantChecker {

    private InvariantChecker() {
        /* this is only a utility class */
    }

    static void check(List<FlatEntry> arena) {
        int[] children = new int[arena.size()];
        int roots = 0;

        for (int id = 0; id < arena.size(); id++) {
            FlatEntry entry = arena.get(id);
            if (entry.descendantCount < 0 || entry.childrenCount < 0) {
                throw new FlatteningInvariantException("Negative count on node " + id);
            }
            if (entry.parent < 0) {
                roots++;
                if (entry.depth != 0) {
                    throw new FlatteningInvariantException("Root " + id + " has depth " + entry.depth);
                }
                continue;
            }
            if (entry.parent >= id) {
                throw new FlatteningInvariantException("Node " + id + " precedes its parent " + entry.parent);
            }
            FlatEntry parent = arena.get(entry.parent);
            if (entry.depth != parent.depth + 1) {
                throw new FlatteningInvariantException("Node " + id + " has depth " + entry.depth
                        + " under a parent at depth " + parent.depth);
            }
            children[entry.parent]++;
        }

        if (!arena.isEmpty() && roots != 1) {
            throw new FlatteningInvariantException("Expected one root, found " + roots);
        }

        for (int id = 0; id < arena.size(); id++) {
            if (children[id] != arena.get(id).childrenCount) {
                throw new FlatteningInvariantException("Node " + id + " counts " + arena.get(id).childrenCount
                        + " children but has " + children[id]);
            }
        }

        if (!arena.isEmpty() && arena.get(0).descendantCount != arena.size() - 1) {
            throw new FlatteningInvariantException("Root has " + arena.get(0).descendantCount
                    + " descendants in a tree of " + arena.size() + " nodes");
        }
    }
}
