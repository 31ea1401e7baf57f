package com.raditha.treeflat.language;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.raditha.treeflat.frontend.JavaParserFrontEnd;
import com.raditha.treeflat.frontend.JavaParserSyntaxNode;
import com.raditha.treeflat.frontend.SyntaxFrontEnd;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.registry.NativeStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Java through JavaParser. Raw types are JavaParser node class names, so the
 * registry table is keyed by {@code MethodDeclaration}, {@code SimpleName} and so on.
 */
public class JavaAdapter extends AbstractLanguageAdapter {

    public JavaAdapter() {
        super("java", List.of(), List.of("java"));

        registerCustom("CompilationUnit", node -> as(node, CompilationUnit.class)
                .filter(cu -> !cu.getTypes().isEmpty())
                .map(cu -> cu.getType(0).getNameAsString())
                .orElse(""));
        registerCustom("PackageDeclaration", node -> as(node, PackageDeclaration.class)
                .map(PackageDeclaration::getNameAsString).orElse(""));
        registerCustom("ImportDeclaration", node -> as(node, ImportDeclaration.class)
                .map(ImportDeclaration::getNameAsString).orElse(""));
        registerCustom("FieldDeclaration", node -> as(node, FieldDeclaration.class)
                .map(field -> String.join(", ", field.getVariables().stream()
                        .map(VariableDeclarator::getNameAsString).toList()))
                .orElse(""));
        registerCustom("MethodCallExpr", node -> as(node, MethodCallExpr.class)
                .map(MethodCallExpr::getNameAsString).orElse(""));
        registerCustom("FieldAccessExpr", node -> as(node, FieldAccessExpr.class)
                .map(FieldAccessExpr::getNameAsString).orElse(""));
        registerCustom("MethodReferenceExpr", node -> as(node, MethodReferenceExpr.class)
                .map(MethodReferenceExpr::getIdentifier).orElse(""));
        registerCustom("ObjectCreationExpr", node -> as(node, ObjectCreationExpr.class)
                .map(creation -> creation.getType().getNameAsString()).orElse(""));
        registerCustom("LambdaExpr", JavaAdapter::lambdaName);
        for (String annotation : List.of("MarkerAnnotationExpr", "SingleMemberAnnotationExpr", "NormalAnnotationExpr")) {
            registerCustom(annotation, node -> as(node, AnnotationExpr.class)
                    .map(AnnotationExpr::getNameAsString).orElse(""));
        }

        registerNative(NativeStrategy.FUNCTION_WITH_PARAMS, JavaAdapter::callable);
        registerNative(NativeStrategy.CLASS_WITH_INHERITANCE, JavaAdapter::typeDeclaration);
        registerNative(NativeStrategy.VARIABLE_WITH_TYPE, JavaAdapter::variable);
        registerNative(NativeStrategy.IMPORT_STATEMENT, JavaAdapter::importDeclaration);
        registerNative(NativeStrategy.FUNCTION_CALL, JavaAdapter::call);
    }

    @Override
    public SyntaxFrontEnd newFrontEnd() {
        return new JavaParserFrontEnd();
    }

    @Override
    public List<String> identifierTypes() {
        return List.of("SimpleName", "Name");
    }

    @Override
    public List<String> qualifiedNameTypes() {
        return List.of("Name", "ClassOrInterfaceType", "FieldAccessExpr");
    }

    private static <T extends Node> Optional<T> as(SyntaxNode node, Class<T> type) {
        if (node instanceof JavaParserSyntaxNode wrapper && type.isInstance(wrapper.node())) {
            return Optional.of(type.cast(wrapper.node()));
        }
        return Optional.empty();
    }

    private static String lambdaName(SyntaxNode node) {
        return as(node, LambdaExpr.class)
                .flatMap(Node::getParentNode)
                .filter(VariableDeclarator.class::isInstance)
                .map(parent -> ((VariableDeclarator) parent).getNameAsString())
                .orElse("");
    }

    private static List<String> modifiers(NodeWithModifiers<?> node) {
        List<String> modifiers = new ArrayList<>();
        node.getModifiers().forEach(m -> modifiers.add(m.getKeyword().asString()));
        return modifiers;
    }

    private static List<String> annotated(Node node, List<String> modifiers) {
        List<String> all = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (child instanceof AnnotationExpr annotation) {
                all.add("@" + annotation.getNameAsString());
            }
        }
        all.addAll(modifiers);
        return all;
    }

    private static String enclosingTypeName(Node node) {
        Optional<TypeDeclaration> owner = node.findAncestor(TypeDeclaration.class);
        if (owner.isEmpty()) {
            return null;
        }
        TypeDeclaration<?> type = owner.get();
        return type.getFullyQualifiedName().orElse(type.getNameAsString());
    }

    private static String qualify(Node node, String name) {
        String owner = enclosingTypeName(node);
        return owner == null ? name : owner + "." + name;
    }

    private static List<NativeContext.Parameter> parameters(NodeList<Parameter> parameters) {
        List<NativeContext.Parameter> result = new ArrayList<>();
        for (Parameter parameter : parameters) {
            String type = parameter.getTypeAsString() + (parameter.isVarArgs() ? "..." : "");
            result.add(new NativeContext.Parameter(parameter.getNameAsString(), type, null));
        }
        return result;
    }

    private static List<NativeContext.Parameter> arguments(NodeList<Expression> arguments) {
        List<NativeContext.Parameter> result = new ArrayList<>();
        for (Expression argument : arguments) {
            result.add(new NativeContext.Parameter(argument.toString()));
        }
        return result;
    }

    private static NativeContext callable(SyntaxNode node) {
        Optional<CallableDeclaration> callable = as(node, CallableDeclaration.class);
        if (callable.isPresent()) {
            CallableDeclaration<?> declaration = callable.get();
            String returnType = declaration instanceof MethodDeclaration method ? method.getTypeAsString() : null;
            return new NativeContext(
                    returnType,
                    parameters(declaration.getParameters()),
                    annotated(declaration, modifiers(declaration)),
                    null,
                    qualify(declaration, declaration.getNameAsString()));
        }
        return as(node, LambdaExpr.class)
                .map(lambda -> new NativeContext(null, parameters(lambda.getParameters()), List.of(), null, null))
                .orElse(NativeContext.empty());
    }

    private static NativeContext typeDeclaration(SyntaxNode node) {
        Optional<TypeDeclaration> found = as(node, TypeDeclaration.class);
        if (found.isEmpty()) {
            return NativeContext.empty();
        }
        TypeDeclaration<?> type = found.get();
        List<ClassOrInterfaceType> supertypes = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration declaration) {
            supertypes.addAll(declaration.getExtendedTypes());
            supertypes.addAll(declaration.getImplementedTypes());
        } else if (type instanceof EnumDeclaration declaration) {
            supertypes.addAll(declaration.getImplementedTypes());
        } else if (type instanceof RecordDeclaration declaration) {
            supertypes.addAll(declaration.getImplementedTypes());
        }
        List<NativeContext.Parameter> bases = supertypes.stream()
                .map(t -> new NativeContext.Parameter(t.asString()))
                .toList();
        String signature = bases.isEmpty() ? null
                : String.join(", ", bases.stream().map(NativeContext.Parameter::name).toList());
        return new NativeContext(
                signature,
                bases,
                annotated(type, modifiers(type)),
                null,
                type.getFullyQualifiedName().orElse(type.getNameAsString()));
    }

    private static NativeContext variable(SyntaxNode node) {
        Optional<VariableDeclarator> declarator = as(node, VariableDeclarator.class);
        if (declarator.isPresent()) {
            VariableDeclarator variable = declarator.get();
            List<String> modifiers = variable.getParentNode()
                    .filter(NodeWithModifiers.class::isInstance)
                    .map(parent -> modifiers((NodeWithModifiers<?>) parent))
                    .orElse(List.of());
            boolean field = variable.getParentNode().filter(FieldDeclaration.class::isInstance).isPresent();
            return new NativeContext(
                    variable.getTypeAsString(),
                    List.of(),
                    modifiers,
                    variable.getInitializer().map(Expression::toString).orElse(null),
                    field ? qualify(variable, variable.getNameAsString()) : variable.getNameAsString());
        }
        return as(node, Parameter.class)
                .map(parameter -> new NativeContext(parameter.getTypeAsString(), List.of(),
                        modifiers(parameter), null, parameter.getNameAsString()))
                .orElse(NativeContext.empty());
    }

    private static NativeContext importDeclaration(SyntaxNode node) {
        return as(node, ImportDeclaration.class)
                .map(declaration -> new NativeContext(
                        null,
                        List.of(new NativeContext.Parameter(
                                declaration.isAsterisk() ? "*" : declaration.getName().getIdentifier())),
                        declaration.isStatic() ? List.of("static") : List.of(),
                        null,
                        declaration.getNameAsString()))
                .orElse(NativeContext.empty());
    }

    private static NativeContext call(SyntaxNode node) {
        Optional<MethodCallExpr> methodCall = as(node, MethodCallExpr.class);
        if (methodCall.isPresent()) {
            MethodCallExpr call = methodCall.get();
            String target = call.getScope()
                    .map(scope -> scope + "." + call.getNameAsString())
                    .orElse(call.getNameAsString());
            return new NativeContext(null, arguments(call.getArguments()), List.of(), null, target);
        }
        return as(node, ObjectCreationExpr.class)
                .map(creation -> new NativeContext(null, arguments(creation.getArguments()),
                        List.of("new"), null, creation.getType().asString()))
                .orElse(NativeContext.empty());
    }
}
