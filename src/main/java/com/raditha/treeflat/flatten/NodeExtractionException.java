package com.raditha.treeflat.flatten;

/**
 * A name, preview or native extractor failed on one node. The batch coordinator
 * turns this into an error node for the unit.
 */
public class NodeExtractionException extends RuntimeException {

    public NodeExtractionException(String rawType, int line, Throwable cause) {
        super("Extraction failed for " + rawType + (line > 0 ? " at line " + line : "") + ": " + cause.getMessage(), cause);
    }
}
