package com.raditha.treeflat.registry;

/**
 * How the preview text of a node is shortened when the preview mode is smart.
 */
public enum PreviewStrategy {
    /** Short text verbatim, long text cut to its first line */
    DEFAULT,

    /** Text up to the opening brace or colon of a body */
    SIGNATURE,

    /** First line only */
    FIRST_LINE,

    /** No preview */
    NONE
}
