package com.raditha.treeflat.flatten;

/**
 * The flattened arena broke one of its structural invariants. Records produced
 * alongside it cannot be trusted, so this is never turned into an error node.
 */
public class FlatteningInvariantException extends IllegalStateException {

    public FlatteningInvariantException(String message) {
        super(message);
    }
}
