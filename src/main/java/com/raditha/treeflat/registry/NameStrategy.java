package com.raditha.treeflat.registry;

/**
 * How the display name of a node is derived.
 */
public enum NameStrategy {
    /** No name */
    NONE,

    /** The node's verbatim source text */
    FULL_TEXT,

    /** Text of the first named child */
    FIRST_CHILD,

    /**
     * First descendant whose raw type is one of the language's identifier types.
     * Direct children are tried before descending.
     */
    FIND_IDENTIFIER,

    /** Property or field identifier, for member access */
    FIND_PROPERTY,

    /** Longest dotted or scoped name, falling back to a plain identifier */
    FIND_QUALIFIED_IDENTIFIER,

    /** Identifier inside a declarator child (C style declarations, JS variable declarators) */
    FIND_IN_DECLARATOR,

    /** Identifier on the left of an assignment */
    FIND_ASSIGNMENT_TARGET,

    /** Callee of a call expression, including dotted receivers */
    FIND_CALL_TARGET,

    /** Delegates to the language's extractor registered for the raw type */
    CUSTOM
}
