package com.raditha.treeflat.taxonomy;

import java.util.List;
import java.util.Optional;

/**
 * The sixty four universal node categories.
 * <p>
 * A code is laid out as {@code [ss kk tt vv]}: super kind, kind, type within the
 * kind and a two bit variant. The constants below carry the code with the variant
 * bits cleared. Variants only have a meaning inside the type that names them, so
 * {@code DEFINITION_FUNCTION | 1} is a lambda while {@code FLOW_LOOP | 1} is an
 * iterator loop.
 */
public enum SemanticType {
    LITERAL_NUMBER(0x00, "INTEGER", "FLOAT", "SCIENTIFIC", "COMPLEX"),
    LITERAL_STRING(0x04, "LITERAL", "TEMPLATE", "REGEX", "RAW"),
    /** true, false, null, None, undefined and symbols */
    LITERAL_ATOMIC(0x08),
    LITERAL_STRUCTURED(0x0C, "GENERIC", "SEQUENCE", "MAPPING", "SET"),

    NAME_KEYWORD(0x10),
    NAME_IDENTIFIER(0x14, "VARIABLE", "FUNCTION", "TYPE", "LABEL"),
    NAME_QUALIFIED(0x18),
    NAME_SCOPED(0x1C),

    PATTERN_DESTRUCTURE(0x20),
    PATTERN_MATCH(0x24),
    PATTERN_TEMPLATE(0x28),
    PATTERN_GUARD(0x2C),

    TYPE_PRIMITIVE(0x30),
    TYPE_COMPOSITE(0x34),
    TYPE_REFERENCE(0x38),
    TYPE_GENERIC(0x3C),

    OPERATOR_ARITHMETIC(0x40, "BINARY", "UNARY", "BITWISE", "RANGE"),
    OPERATOR_LOGICAL(0x44),
    OPERATOR_COMPARISON(0x48, "EQUALITY", "RELATIONAL", "MEMBERSHIP", "PATTERN"),
    OPERATOR_ASSIGNMENT(0x4C, "SIMPLE", "COMPOUND", "DESTRUCTURE", "AUGMENTED"),

    COMPUTATION_CALL(0x50, "FUNCTION", "METHOD", "CONSTRUCTOR", "MACRO"),
    /** Member, index and attribute access */
    COMPUTATION_ACCESS(0x54),
    COMPUTATION_EXPRESSION(0x58),
    COMPUTATION_LAMBDA(0x5C),

    TRANSFORM_QUERY(0x60),
    TRANSFORM_ITERATION(0x64),
    TRANSFORM_PROJECTION(0x68),
    TRANSFORM_AGGREGATION(0x6C),

    DEFINITION_FUNCTION(0x70, "REGULAR", "LAMBDA", "CONSTRUCTOR", "ASYNC"),
    DEFINITION_VARIABLE(0x74, "MUTABLE", "IMMUTABLE", "PARAMETER", "FIELD"),
    DEFINITION_CLASS(0x78, "REGULAR", "ABSTRACT", "GENERIC", "ENUM"),
    DEFINITION_MODULE(0x7C),

    EXECUTION_STATEMENT(0x80),
    EXECUTION_DECLARATION(0x84),
    EXECUTION_INVOCATION(0x88),
    EXECUTION_MUTATION(0x8C),

    FLOW_CONDITIONAL(0x90, "BINARY", "MULTIWAY", "GUARD", "TERNARY"),
    FLOW_LOOP(0x94, "COUNTER", "ITERATOR", "CONDITIONAL", "INFINITE"),
    FLOW_JUMP(0x98, "RETURN", "BREAK", "CONTINUE", "GOTO"),
    FLOW_SYNC(0x9C),

    ERROR_TRY(0xA0),
    ERROR_CATCH(0xA4),
    ERROR_THROW(0xA8),
    ERROR_FINALLY(0xAC),

    ORGANIZATION_BLOCK(0xB0),
    ORGANIZATION_LIST(0xB4, "SEQUENTIAL", "COLLECTION", "MAPPING", "HIERARCHICAL"),
    ORGANIZATION_SECTION(0xB8),
    ORGANIZATION_CONTAINER(0xBC),

    METADATA_COMMENT(0xC0),
    METADATA_ANNOTATION(0xC4),
    METADATA_DIRECTIVE(0xC8),
    METADATA_DEBUG(0xCC),

    EXTERNAL_IMPORT(0xD0, "MODULE", "SELECTIVE", "WILDCARD", "RELATIVE"),
    EXTERNAL_EXPORT(0xD4),
    EXTERNAL_FOREIGN(0xD8),
    EXTERNAL_EMBED(0xDC),

    PARSER_PUNCTUATION(0xE0),
    PARSER_DELIMITER(0xE4),
    PARSER_SYNTAX(0xE8),
    /** Fallback for raw types with no registry entry */
    PARSER_CONSTRUCT(0xEC),

    /** Synthesised for units that failed to parse or extract */
    PARSE_ERROR(0xF0),
    RESERVED_FUTURE2(0xF4),
    RESERVED_FUTURE3(0xF8),
    RESERVED_FUTURE4(0xFC);

    /** Clears the variant bits. */
    public static final int TYPE_MASK = 0xFC;
    public static final int VARIANT_MASK = 0x03;

    private static final SemanticType[] BY_CODE = new SemanticType[64];

    static {
        for (SemanticType type : values()) {
            BY_CODE[type.code >> 2] = type;
        }
    }

    private final int code;
    private final List<String> variants;

    SemanticType(int code, String... variants) {
        this.code = code;
        this.variants = List.of(variants);
    }

    public int code() {
        return code;
    }

    public Kind kind() {
        return Kind.of(code).orElseThrow();
    }

    public SuperKind superKind() {
        return kind().superKind();
    }

    /**
     * Named refinements of this type, indexed by their two bit value. Empty when
     * the type defines none.
     */
    public List<String> variants() {
        return variants;
    }

    /**
     * Code of this type refined by a named variant.
     *
     * @throws IllegalArgumentException if this type has no such variant
     */
    public int withVariant(String variant) {
        int index = variants.indexOf(variant);
        if (index < 0) {
            throw new IllegalArgumentException(name() + " has no variant " + variant
                    + ". Valid variants are: " + String.join(", ", variants));
        }
        return code | index;
    }

    public static Optional<SemanticType> of(int code) {
        if (code < 0 || code > 0xFF) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[(code & TYPE_MASK) >> 2]);
    }
}
