package com.raditha.treeflat.taxonomy;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Queries over semantic type codes. Every method is total: codes outside 0..255
 * and unknown names produce an empty result or {@code false}, never an exception.
 */
public class SemanticTypes {

    private static final char VARIANT_SEPARATOR = '/';

    private static final Map<String, Set<SemanticType>> ALIASES = Map.of(
            "FUNCTION", EnumSet.of(SemanticType.DEFINITION_FUNCTION, SemanticType.COMPUTATION_LAMBDA),
            "CLASS", EnumSet.of(SemanticType.DEFINITION_CLASS),
            "VARIABLE", EnumSet.of(SemanticType.DEFINITION_VARIABLE),
            "IDENTIFIER", EnumSet.of(SemanticType.NAME_IDENTIFIER, SemanticType.NAME_QUALIFIED,
                    SemanticType.NAME_SCOPED),
            "CALL", EnumSet.of(SemanticType.COMPUTATION_CALL, SemanticType.EXECUTION_INVOCATION),
            "CONTROL_FLOW", EnumSet.of(SemanticType.FLOW_CONDITIONAL, SemanticType.FLOW_LOOP,
                    SemanticType.FLOW_JUMP, SemanticType.FLOW_SYNC),
            "ERROR", EnumSet.of(SemanticType.PARSE_ERROR));

    private static final Set<Integer> SEARCHABLE;

    static {
        Set<Integer> searchable = new LinkedHashSet<>();
        for (SemanticType type : SemanticType.values()) {
            if (type.kind() == Kind.DEFINITION) {
                searchable.add(type.code());
            }
        }
        searchable.add(SemanticType.COMPUTATION_CALL.code());
        searchable.add(SemanticType.NAME_IDENTIFIER.code());
        searchable.add(SemanticType.NAME_QUALIFIED.code());
        searchable.add(SemanticType.EXTERNAL_IMPORT.code());
        searchable.add(SemanticType.EXTERNAL_EXPORT.code());
        SEARCHABLE = Collections.unmodifiableSet(searchable);
    }

    private SemanticTypes() {
        /* this is only a utility class */
    }

    /**
     * Name of a code: the type name, plus the variant name when the code carries a
     * non-zero named variant, for example {@code DEFINITION_FUNCTION/LAMBDA}.
     * {@link #resolve(String)} maps the result back to the same code for every
     * code with a named or zero variant.
     */
    public static Optional<String> classify(int code) {
        return SemanticType.of(code).map(type -> variantName(code)
                .filter(v -> variantOf(code) != 0)
                .map(v -> type.name() + VARIANT_SEPARATOR + v)
                .orElse(type.name()));
    }

    /**
     * Code for a type name, optionally refined by {@code TYPE/VARIANT}.
     * Matching is case insensitive.
     */
    public static Optional<Integer> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        String variant = null;
        int slash = normalized.indexOf(VARIANT_SEPARATOR);
        if (slash >= 0) {
            variant = normalized.substring(slash + 1);
            normalized = normalized.substring(0, slash);
        }
        SemanticType type;
        try {
            type = SemanticType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (variant == null) {
            return Optional.of(type.code());
        }
        int index = type.variants().indexOf(variant);
        return index < 0 ? Optional.empty() : Optional.of(type.code() | index);
    }

    public static Optional<Kind> kindOf(int code) {
        return Kind.of(code);
    }

    public static Optional<SuperKind> superKindOf(int code) {
        return SuperKind.of(code);
    }

    /**
     * The two variant bits, or -1 for codes outside the byte range.
     */
    public static int variantOf(int code) {
        if (code < 0 || code > 0xFF) {
            return -1;
        }
        return code & SemanticType.VARIANT_MASK;
    }

    public static Optional<String> variantName(int code) {
        return SemanticType.of(code).flatMap(type -> {
            int variant = code & SemanticType.VARIANT_MASK;
            return variant < type.variants().size()
                    ? Optional.of(type.variants().get(variant))
                    : Optional.empty();
        });
    }

    /**
     * Tests whether a code falls in a category. The category may name a super kind,
     * a kind, a semantic type or one of the aliases FUNCTION, CLASS, VARIABLE,
     * IDENTIFIER, CALL, CONTROL_FLOW and ERROR. Unknown categories match nothing.
     */
    public static boolean isIn(int code, String category) {
        Optional<SemanticType> type = SemanticType.of(code);
        if (type.isEmpty() || category == null) {
            return false;
        }
        String key = category.trim().toUpperCase(Locale.ROOT);
        Set<SemanticType> alias = ALIASES.get(key);
        if (alias != null) {
            return alias.contains(type.get());
        }
        if (key.equals(type.get().name())) {
            return true;
        }
        if (key.equals(type.get().kind().name())) {
            return true;
        }
        return key.equals(type.get().superKind().name());
    }

    /**
     * Categories worth offering to a search front end: every definition, calls,
     * identifiers, qualified names, imports and exports.
     */
    public static Set<Integer> searchableCodes() {
        return SEARCHABLE;
    }

    public static List<SemanticType> all() {
        return Arrays.asList(SemanticType.values());
    }

    public static Set<String> categories() {
        Set<String> names = new LinkedHashSet<>();
        for (SuperKind s : SuperKind.values()) {
            names.add(s.name());
        }
        for (Kind k : Kind.values()) {
            names.add(k.name());
        }
        names.addAll(ALIASES.keySet());
        return names;
    }

    public static boolean isDefinition(int code) {
        return hasKind(code, Kind.DEFINITION);
    }

    public static boolean isCall(int code) {
        return isIn(code, "CALL");
    }

    public static boolean isControlFlow(int code) {
        return hasKind(code, Kind.FLOW_CONTROL);
    }

    public static boolean isIdentifier(int code) {
        return isIn(code, "IDENTIFIER");
    }

    public static boolean isLiteral(int code) {
        return hasKind(code, Kind.LITERAL);
    }

    public static boolean isOperator(int code) {
        return hasKind(code, Kind.OPERATOR);
    }

    public static boolean isType(int code) {
        return hasKind(code, Kind.TYPE);
    }

    public static boolean isExternal(int code) {
        return hasKind(code, Kind.EXTERNAL);
    }

    public static boolean isError(int code) {
        return matches(code, c -> (c & SemanticType.TYPE_MASK) == SemanticType.PARSE_ERROR.code());
    }

    public static boolean isMetadata(int code) {
        return hasKind(code, Kind.METADATA);
    }

    private static boolean hasKind(int code, Kind kind) {
        return matches(code, c -> (c & Kind.MASK) == kind.code());
    }

    private static boolean matches(int code, IntPredicate test) {
        return code >= 0 && code <= 0xFF && test.test(code);
    }
}
