package com.raditha.treeflat.model;

import java.util.List;

/**
 * Language specific detail attached at the native context level. Values are
 * reported as the source spells them and are not interpreted.
 *
 * @param signatureType return type, declared type or base class list
 * @param parameters    parameters of a function, arguments of a call, names of an import
 * @param modifiers     modifiers and decorators such as {@code static}, {@code async}, {@code @Override}
 * @param defaults      initial value of a variable or default of a single parameter
 * @param qualifiedName dotted name including enclosing classes or the imported module
 */
public record NativeContext(
        String signatureType,
        List<Parameter> parameters,
        List<String> modifiers,
        String defaults,
        String qualifiedName) {

    private static final NativeContext EMPTY = new NativeContext(null, List.of(), List.of(), null, null);

    public NativeContext {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public static NativeContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    /**
     * One parameter, argument or imported name.
     */
    public record Parameter(String name, String type, String defaultValue) {
        public Parameter(String name) {
            this(name, null, null);
        }
    }
}
