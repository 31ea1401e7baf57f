package com.raditha.treeflat.language;

import com.raditha.treeflat.batch.BatchCoordinator;
import com.raditha.treeflat.config.ExtractionConfig;
import com.raditha.treeflat.config.ReadOptions;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.model.NativeContext.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptAdapterTest {

    private final BatchCoordinator coordinator = new BatchCoordinator();

    private List<AstNode> parse(String source) {
        return coordinator.parseText(source, "javascript", ReadOptions.of(ExtractionConfig.full())).nodes();
    }

    private static List<AstNode> all(List<AstNode> nodes, String rawType) {
        return nodes.stream()
                .filter(n -> rawType.equals(n.rawType()) && n.childrenCount() > 0)
                .toList();
    }

    private static AstNode find(List<AstNode> nodes, String rawType) {
        List<AstNode> found = all(nodes, rawType);
        assertFalse(found.isEmpty(), "no " + rawType);
        return found.get(0);
    }

    @Test
    void testArrowFunctionNamedByDeclarator() {
        List<AstNode> nodes = parse("const f = (a, b = 2) => a + b;");

        AstNode arrow = find(nodes, "arrow_function");
        assertEquals("f", arrow.name());
        assertEquals("f", arrow.nativeContext().qualifiedName());
        assertEquals(List.of(new Parameter("a"), new Parameter("b", null, "2")), arrow.nativeContext().parameters());

        AstNode declarator = find(nodes, "variable_declarator");
        NativeContext context = declarator.nativeContext();
        assertEquals("f", declarator.name());
        assertEquals(List.of("const"), context.modifiers());
        assertEquals("(a, b = 2) => a + b", context.defaults());
    }

    @Test
    void testSingleParameterArrow() {
        AstNode arrow = find(parse("let g = x => x;"), "arrow_function");
        assertEquals("g", arrow.name());
        assertEquals(List.of(new Parameter("x")), arrow.nativeContext().parameters());
    }

    @Test
    void testFunctionExpressionNames() {
        List<AstNode> nodes = parse("const o = { greet: function () {}, 'quoted-key': 1 };\nobj.handler = function () {};\n");

        List<AstNode> functions = all(nodes, "function_expression");
        assertEquals(2, functions.size());
        assertEquals("greet", functions.get(0).name());
        assertEquals("obj.handler", functions.get(1).name());

        List<AstNode> pairs = all(nodes, "pair");
        assertEquals("greet", pairs.get(0).name());
        assertEquals("quoted-key", pairs.get(1).name());
    }

    @Test
    void testClassAndMethodModifiers() {
        List<AstNode> nodes = parse("class Dog extends Animal {\n  static async bark() {}\n  get name() { return 1; }\n}\n");

        AstNode type = find(nodes, "class_declaration");
        assertEquals("Dog", type.name());
        assertEquals("Animal", type.nativeContext().signatureType());

        List<AstNode> methods = all(nodes, "method_definition");
        assertEquals(2, methods.size());
        assertEquals("bark", methods.get(0).name());
        assertEquals(List.of("static", "async"), methods.get(0).nativeContext().modifiers());
        assertEquals("Dog.bark", methods.get(0).nativeContext().qualifiedName());
        assertEquals(List.of("get"), methods.get(1).nativeContext().modifiers());
    }

    @Test
    void testGeneratorModifier() {
        AstNode generator = find(parse("function* gen() {}"), "generator_function_declaration");
        assertEquals("gen", generator.name());
        assertEquals(List.of("generator"), generator.nativeContext().modifiers());
    }

    @Test
    void testFunctionDeclarationDefaults() {
        AstNode function = find(parse("function add(a, b = 2) { return a + b; }"), "function_declaration");
        assertEquals("add", function.name());
        assertEquals(List.of(new Parameter("a"), new Parameter("b", null, "2")), function.nativeContext().parameters());
    }

    @Test
    void testImportSpecifiers() {
        AstNode statement = find(parse("import React, { useState as us, useEffect } from \"react\";"), "import_statement");
        NativeContext context = statement.nativeContext();

        assertEquals("react", statement.name());
        assertEquals("react", context.qualifiedName());
        assertEquals(List.of(
                new Parameter("React", null, "default"),
                new Parameter("useState", null, "us"),
                new Parameter("useEffect")), context.parameters());
    }

    @Test
    void testNamespaceImport() {
        NativeContext context = find(parse("import * as path from 'path';"), "import_statement").nativeContext();
        assertEquals(List.of(new Parameter("*", null, "path")), context.parameters());
    }

    @Test
    void testExportNames() {
        List<AstNode> exports = all(parse("export const answer = 42;\nexport default function () {}\n"), "export_statement");
        assertEquals(2, exports.size());
        assertEquals("answer", exports.get(0).name());
        assertEquals("default", exports.get(1).name());
    }

    @Test
    void testCallTargets() {
        List<AstNode> nodes = parse("foo.bar(1, x);\nnew Widget(3);\n");

        AstNode call = find(nodes, "call_expression");
        assertEquals("foo.bar", call.name());
        assertEquals("foo.bar", call.nativeContext().qualifiedName());
        assertEquals(List.of(new Parameter("1"), new Parameter("x")), call.nativeContext().parameters());

        AstNode creation = find(nodes, "new_expression");
        assertEquals("Widget", creation.name());
        assertEquals(List.of(new Parameter("3")), creation.nativeContext().parameters());
    }
}
