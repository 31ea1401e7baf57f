package com.raditha.treeflat.registry;

/**
 * Language specific detail attached to a node when the context level is native.
 */
public enum NativeStrategy {
    NONE,
    /** Parameters with types and defaults, return type and modifiers */
    FUNCTION_WITH_PARAMS,
    /** Base classes and modifiers */
    CLASS_WITH_INHERITANCE,
    /** Declared type and initial value */
    VARIABLE_WITH_TYPE,
    /** Module path and imported names */
    IMPORT_STATEMENT,
    /** Callee and argument list */
    FUNCTION_CALL
}
