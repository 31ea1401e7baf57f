package com.raditha.treeflat.language;

import com.raditha.treeflat.frontend.SyntaxFrontEnd;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.frontend.TreeSitterFrontEnd;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.model.NativeContext.Parameter;
import com.raditha.treeflat.registry.NativeStrategy;
import org.treesitter.TreeSitterJavascript;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.raditha.treeflat.language.TreeSitterNatives.fieldText;

/**
 * JavaScript through the tree-sitter-javascript grammar.
 */
public class JavaScriptAdapter extends AbstractLanguageAdapter {

    private static final Set<String> SCOPES = Set.of("class_declaration", "class", "function_declaration");
    private static final List<String> METHOD_MODIFIERS = List.of("static", "async", "get", "set", "*");

    public JavaScriptAdapter() {
        super("javascript", List.of("js", "node"), List.of("js", "jsx", "mjs", "cjs"));

        registerCustom("arrow_function", JavaScriptAdapter::functionExpressionName);
        registerCustom("function_expression", JavaScriptAdapter::functionExpressionName);
        registerCustom("function", JavaScriptAdapter::functionExpressionName);
        registerCustom("pair", node -> unquoted(fieldText(node, "key")));
        registerCustom("export_statement", JavaScriptAdapter::exportName);
        registerCustom("import_statement", node -> unquoted(fieldText(node, "source")));

        registerNative(NativeStrategy.FUNCTION_WITH_PARAMS, JavaScriptAdapter::function);
        registerNative(NativeStrategy.CLASS_WITH_INHERITANCE, JavaScriptAdapter::classDeclaration);
        registerNative(NativeStrategy.VARIABLE_WITH_TYPE, JavaScriptAdapter::declarator);
        registerNative(NativeStrategy.IMPORT_STATEMENT, JavaScriptAdapter::importStatement);
        registerNative(NativeStrategy.FUNCTION_CALL, node -> new NativeContext(
                null,
                TreeSitterNatives.arguments(node.childByField("arguments").orElse(null), ""),
                List.of(),
                null,
                node.childByField("function").or(() -> node.childByField("constructor"))
                        .map(SyntaxNode::text).orElse(null)));
    }

    @Override
    public SyntaxFrontEnd newFrontEnd() {
        return new TreeSitterFrontEnd(name(), TreeSitterJavascript::new);
    }

    @Override
    public List<String> identifierTypes() {
        return List.of("identifier", "property_identifier", "private_property_identifier",
                "shorthand_property_identifier");
    }

    @Override
    public List<String> qualifiedNameTypes() {
        return List.of("member_expression");
    }

    private static String unquoted(String text) {
        return text == null ? "" : TreeSitterNatives.unquote(text);
    }

    /**
     * Anonymous functions are named after what they are bound to:
     * {@code const f = () => 1}, {@code obj.f = function() {}} or {@code {f: () => 1}}.
     */
    private static String functionExpressionName(SyntaxNode node) {
        String own = fieldText(node, "name");
        if (own != null) {
            return own;
        }
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return "";
        }
        String bound = switch (parent.rawType()) {
            case "variable_declarator" -> fieldText(parent, "name");
            case "assignment_expression" -> fieldText(parent, "left");
            case "pair" -> unquoted(fieldText(parent, "key"));
            default -> null;
        };
        return bound == null ? "" : bound;
    }

    private static String exportName(SyntaxNode node) {
        if (TreeSitterNatives.hasToken(node, "default")) {
            return "default";
        }
        return node.childByField("declaration")
                .map(declaration -> {
                    String name = fieldText(declaration, "name");
                    if (name != null) {
                        return name;
                    }
                    return declaration.namedChildren().stream()
                            .filter(c -> c.rawType().equals("variable_declarator"))
                            .findFirst()
                            .map(c -> fieldText(c, "name"))
                            .orElse("");
                })
                .orElse("");
    }

    private static NativeContext function(SyntaxNode node) {
        List<Parameter> parameters = new ArrayList<>();
        SyntaxNode single = node.childByField("parameter").orElse(null);
        if (single != null) {
            parameters.add(new Parameter(single.text()));
        }
        node.childByField("parameters").ifPresent(list -> {
            for (SyntaxNode parameter : list.namedChildren()) {
                if (parameter.rawType().equals("assignment_pattern")) {
                    parameters.add(new Parameter(fieldText(parameter, "left"), null, fieldText(parameter, "right")));
                } else if (!parameter.rawType().equals("comment")) {
                    parameters.add(new Parameter(parameter.text()));
                }
            }
        });

        List<String> modifiers = new ArrayList<>();
        for (String token : METHOD_MODIFIERS) {
            if (TreeSitterNatives.hasToken(node, token)) {
                modifiers.add(token.equals("*") ? "generator" : token);
            }
        }
        if (node.rawType().startsWith("generator_") && !modifiers.contains("generator")) {
            modifiers.add("generator");
        }

        String name = fieldText(node, "name");
        if (name == null) {
            name = functionExpressionName(node);
        }
        return new NativeContext(null, parameters, modifiers, null,
                TreeSitterNatives.qualifiedName(node, name, SCOPES));
    }

    private static NativeContext classDeclaration(SyntaxNode node) {
        String base = null;
        List<Parameter> bases = new ArrayList<>();
        for (SyntaxNode child : node.namedChildren()) {
            if (child.rawType().equals("class_heritage")) {
                for (SyntaxNode expression : child.namedChildren()) {
                    bases.add(new Parameter(expression.text()));
                }
                base = String.join(", ", bases.stream().map(Parameter::name).toList());
            }
        }
        return new NativeContext(base, bases, List.of(), null,
                TreeSitterNatives.qualifiedName(node, fieldText(node, "name"), SCOPES));
    }

    /**
     * {@code const x = 1} reports {@code const} as a modifier and {@code 1} as the default.
     */
    private static NativeContext declarator(SyntaxNode node) {
        List<String> modifiers = new ArrayList<>();
        SyntaxNode declaration = node.parent();
        if (declaration != null && declaration.childCount() > 0) {
            SyntaxNode keyword = declaration.child(0);
            if (!keyword.isNamed()) {
                modifiers.add(keyword.rawType());
            }
        }
        return new NativeContext(null, List.of(), modifiers, fieldText(node, "value"), fieldText(node, "name"));
    }

    private static NativeContext importStatement(SyntaxNode node) {
        List<Parameter> names = new ArrayList<>();
        for (SyntaxNode clause : node.namedChildren()) {
            if (clause.rawType().equals("import_clause")) {
                collectImports(clause, names);
            }
        }
        return new NativeContext(null, names, List.of(), null, unquoted(fieldText(node, "source")));
    }

    private static void collectImports(SyntaxNode clause, List<Parameter> names) {
        for (SyntaxNode part : clause.namedChildren()) {
            switch (part.rawType()) {
                case "identifier" -> names.add(new Parameter(part.text(), null, "default"));
                case "namespace_import" -> names.add(new Parameter("*", null,
                        part.namedChildren().stream().findFirst().map(SyntaxNode::text).orElse(null)));
                case "named_imports" -> {
                    for (SyntaxNode specifier : part.namedChildren()) {
                        if (specifier.rawType().equals("import_specifier")) {
                            names.add(new Parameter(fieldText(specifier, "name"), null, fieldText(specifier, "alias")));
                        }
                    }
                }
                default -> collectImports(part, names);
            }
        }
    }
}
