package com.raditha.treeflat.language;

import com.raditha.treeflat.frontend.SyntaxFrontEnd;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.frontend.TreeSitterFrontEnd;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.model.NativeContext.Parameter;
import com.raditha.treeflat.registry.NativeStrategy;
import org.treesitter.TreeSitterPython;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.raditha.treeflat.language.TreeSitterNatives.fieldText;

/**
 * Python through the tree-sitter-python grammar.
 */
public class PythonAdapter extends AbstractLanguageAdapter {

    private static final Set<String> SCOPES = Set.of("class_definition", "function_definition");

    public PythonAdapter() {
        super("python", List.of("py"), List.of("py", "pyi", "pyw"));

        registerCustom("decorated_definition", PythonAdapter::decoratedName);
        registerCustom("lambda", PythonAdapter::lambdaName);
        registerCustom("keyword_argument", node -> orEmpty(fieldText(node, "name")));
        registerCustom("import_from_statement", node -> orEmpty(fieldText(node, "module_name")));
        registerCustom("aliased_import", node -> orEmpty(fieldText(node, "alias")));

        registerNative(NativeStrategy.FUNCTION_WITH_PARAMS, PythonAdapter::function);
        registerNative(NativeStrategy.CLASS_WITH_INHERITANCE, PythonAdapter::classDefinition);
        registerNative(NativeStrategy.VARIABLE_WITH_TYPE, PythonAdapter::assignment);
        registerNative(NativeStrategy.IMPORT_STATEMENT, PythonAdapter::importStatement);
        registerNative(NativeStrategy.FUNCTION_CALL, node -> new NativeContext(
                null,
                TreeSitterNatives.arguments(node.childByField("arguments").orElse(null), "keyword_argument"),
                List.of(),
                null,
                fieldText(node, "function")));
    }

    @Override
    public SyntaxFrontEnd newFrontEnd() {
        return new TreeSitterFrontEnd(name(), TreeSitterPython::new);
    }

    @Override
    public List<String> identifierTypes() {
        return List.of("identifier");
    }

    @Override
    public List<String> qualifiedNameTypes() {
        return List.of("dotted_name", "attribute");
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String decoratedName(SyntaxNode node) {
        return node.childByField("definition")
                .map(definition -> orEmpty(fieldText(definition, "name")))
                .orElse("");
    }

    /**
     * A lambda takes the name it is assigned to, {@code square = lambda x: x * x}.
     */
    private static String lambdaName(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent != null && parent.rawType().equals("assignment")) {
            return parent.childByField("left")
                    .filter(left -> left.rawType().equals("identifier"))
                    .map(SyntaxNode::text)
                    .orElse("");
        }
        return "";
    }

    private static NativeContext function(SyntaxNode node) {
        List<Parameter> parameters = new ArrayList<>();
        node.childByField("parameters").ifPresent(list -> {
            for (SyntaxNode parameter : list.namedChildren()) {
                parameters.add(parameter(parameter));
            }
        });

        List<String> modifiers = new ArrayList<>();
        if (TreeSitterNatives.hasToken(node, "async")) {
            modifiers.add("async");
        }
        SyntaxNode parent = node.parent();
        if (parent != null && parent.rawType().equals("decorated_definition")) {
            for (SyntaxNode decorator : parent.namedChildren()) {
                if (decorator.rawType().equals("decorator")) {
                    modifiers.add(decorator.text());
                }
            }
        }

        String name = fieldText(node, "name");
        return new NativeContext(
                fieldText(node, "return_type"),
                parameters,
                modifiers,
                null,
                TreeSitterNatives.qualifiedName(node, name, SCOPES));
    }

    private static Parameter parameter(SyntaxNode parameter) {
        return switch (parameter.rawType()) {
            case "identifier" -> new Parameter(parameter.text());
            case "typed_parameter" -> new Parameter(
                    parameter.namedChildren().stream().findFirst().map(SyntaxNode::text).orElse(parameter.text()),
                    fieldText(parameter, "type"),
                    null);
            case "default_parameter" -> new Parameter(
                    fieldText(parameter, "name"), null, fieldText(parameter, "value"));
            case "typed_default_parameter" -> new Parameter(
                    fieldText(parameter, "name"), fieldText(parameter, "type"), fieldText(parameter, "value"));
            default -> new Parameter(parameter.text());
        };
    }

    private static NativeContext classDefinition(SyntaxNode node) {
        List<Parameter> bases = new ArrayList<>();
        String signature = null;
        SyntaxNode superclasses = node.childByField("superclasses").orElse(null);
        if (superclasses != null) {
            for (SyntaxNode base : superclasses.namedChildren()) {
                bases.add(new Parameter(base.text()));
            }
            signature = String.join(", ", bases.stream().map(Parameter::name).toList());
        }
        String name = fieldText(node, "name");
        return new NativeContext(signature, bases, List.of(), null,
                TreeSitterNatives.qualifiedName(node, name, SCOPES));
    }

    private static NativeContext assignment(SyntaxNode node) {
        return new NativeContext(
                fieldText(node, "type"),
                List.of(),
                List.of(),
                fieldText(node, "right"),
                fieldText(node, "left"));
    }

    /**
     * {@code import a.b, c as d} lists every module; {@code from m import x, y as z}
     * reports {@code m} as the qualified name and the imported names as parameters.
     */
    private static NativeContext importStatement(SyntaxNode node) {
        List<Parameter> names = new ArrayList<>();
        String module = fieldText(node, "module_name");
        List<SyntaxNode> children = node.namedChildren();
        for (int i = module == null ? 0 : 1; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            String type = child.rawType();
            if (type.equals("dotted_name")) {
                names.add(new Parameter(child.text()));
            } else if (type.equals("aliased_import")) {
                names.add(new Parameter(fieldText(child, "name"), null, fieldText(child, "alias")));
            } else if (type.equals("wildcard_import")) {
                names.add(new Parameter("*"));
            }
        }
        return new NativeContext(null, names, List.of(), null, module);
    }
}
