package com.raditha.treeflat.language;

import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.model.NativeContext.Parameter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Field based helpers shared by the tree-sitter languages.
 */
final class TreeSitterNatives {

    private TreeSitterNatives() {
        /* this is only a utility class */
    }

    static String fieldText(SyntaxNode node, String field) {
        return node.childByField(field).map(SyntaxNode::text).orElse(null);
    }

    static boolean hasToken(SyntaxNode node, String token) {
        for (int i = 0; i < node.childCount(); i++) {
            SyntaxNode child = node.child(i);
            if (!child.isNamed() && token.equals(child.rawType())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Dotted name of a declaration, prefixed by the names of its enclosing
     * declarations of the given raw types.
     */
    static String qualifiedName(SyntaxNode node, String name, Set<String> scopeTypes) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        Deque<String> parts = new ArrayDeque<>();
        parts.push(name);
        for (SyntaxNode scope = node.parent(); scope != null; scope = scope.parent()) {
            if (scopeTypes.contains(scope.rawType())) {
                String scopeName = fieldText(scope, "name");
                if (scopeName != null) {
                    parts.push(scopeName);
                }
            }
        }
        return String.join(".", parts);
    }

    /**
     * Call arguments as parameters. Keyword arguments keep their name and carry the
     * value as default, positional ones are reported by their text.
     */
    static List<Parameter> arguments(SyntaxNode arguments, String keywordType) {
        List<Parameter> result = new ArrayList<>();
        if (arguments == null) {
            return result;
        }
        for (SyntaxNode argument : arguments.namedChildren()) {
            if (argument.rawType().equals("comment")) {
                continue;
            }
            if (argument.rawType().equals(keywordType)) {
                result.add(new Parameter(fieldText(argument, "name"), null, fieldText(argument, "value")));
            } else {
                result.add(new Parameter(argument.text()));
            }
        }
        return result;
    }

    static String unquote(String literal) {
        if (literal == null || literal.length() < 2) {
            return literal;
        }
        char first = literal.charAt(0);
        char last = literal.charAt(literal.length() - 1);
        if ((first == '"' || first == '\'' || first == '`') && first == last) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }
}
