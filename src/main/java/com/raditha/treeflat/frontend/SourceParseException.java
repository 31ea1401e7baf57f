package com.raditha.treeflat.frontend;

/**
 * Thrown when a front end rejects the source of a unit.
 */
public class SourceParseException extends Exception {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
