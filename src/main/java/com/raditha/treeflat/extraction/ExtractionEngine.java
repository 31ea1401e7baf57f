package com.raditha.treeflat.extraction;

import com.raditha.treeflat.config.PreviewSetting;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.language.LanguageAdapter;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.registry.NameStrategy;
import com.raditha.treeflat.registry.NativeStrategy;
import com.raditha.treeflat.registry.PreviewStrategy;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Computes names, previews and native detail for nodes of one language.
 * <p>
 * Every method is a function of the node's subtree and the adapter's static
 * tables only, so the same subtree always yields the same strings.
 */
public class ExtractionEngine {

    /** Smart previews keep texts of this length or shorter unchanged. */
    static final int SHORT_TEXT = 50;
    /** Longest line a smart preview keeps unchanged. */
    static final int MAX_LINE = 80;
    private static final String ELLIPSIS = "...";

    private static final List<String> PROPERTY_TYPES = List.of(
            "property_identifier", "field_identifier", "private_property_identifier");

    private final LanguageAdapter adapter;

    public ExtractionEngine(LanguageAdapter adapter) {
        this.adapter = adapter;
    }

    /**
     * Derives the display name of a node.
     *
     * @return the name, empty when the strategy finds none
     */
    public String extractName(SyntaxNode node, NameStrategy strategy) {
        return switch (strategy) {
            case NONE -> "";
            case FULL_TEXT -> node.text();
            case FIRST_CHILD -> node.namedChildren().stream().findFirst().map(SyntaxNode::text).orElse("");
            case FIND_IDENTIFIER -> findIdentifier(node);
            case FIND_PROPERTY -> findProperty(node);
            case FIND_QUALIFIED_IDENTIFIER -> findQualified(node);
            case FIND_IN_DECLARATOR -> findInDeclarator(node);
            case FIND_ASSIGNMENT_TARGET -> findAssignmentTarget(node);
            case FIND_CALL_TARGET -> findCallTarget(node);
            case CUSTOM -> adapter.customExtractor(node.rawType())
                    .map(extractor -> extractor.extract(node))
                    .orElseGet(() -> findIdentifier(node));
        };
    }

    /**
     * Produces the preview text of a node.
     *
     * @return the preview, or {@code null} when previews are disabled
     */
    public String extractPreview(SyntaxNode node, PreviewStrategy strategy, PreviewSetting setting) {
        return preview(node.text(), strategy, setting);
    }

    public NativeContext extractNative(SyntaxNode node, NativeStrategy strategy) {
        if (strategy == NativeStrategy.NONE) {
            return NativeContext.empty();
        }
        return adapter.nativeExtractor(strategy)
                .map(extractor -> extractor.extract(node))
                .orElse(NativeContext.empty());
    }

    /**
     * Applies a preview setting to a text.
     */
    public static String preview(String text, PreviewStrategy strategy, PreviewSetting setting) {
        return switch (setting.mode()) {
            case NONE -> null;
            case FULL -> text;
            case LIMIT -> truncate(text, setting.limit());
            case SMART -> shorten(text, strategy);
        };
    }

    /**
     * Bounded preview following a node's preview strategy.
     */
    public static String shorten(String text, PreviewStrategy strategy) {
        return switch (strategy) {
            case NONE -> "";
            case FIRST_LINE -> capLine(firstLine(text));
            case SIGNATURE -> capLine(signature(text));
            case DEFAULT -> {
                if (text.length() <= SHORT_TEXT) {
                    yield text;
                }
                yield capLine(firstLine(text));
            }
        };
    }

    /**
     * First {@code limit} characters, never splitting a surrogate pair.
     */
    static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        int end = limit;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static String capLine(String line) {
        if (line.length() <= MAX_LINE) {
            return line;
        }
        return truncate(line, MAX_LINE - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        String line = newline < 0 ? text : text.substring(0, newline);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /**
     * Header of a multi line construct: everything before the body opener.
     */
    private static String signature(String text) {
        if (text.indexOf('\n') < 0) {
            return text;
        }
        int cut = bodyOpener(text);
        String header = cut < 0 ? firstLine(text) : text.substring(0, cut);
        return header.replaceAll("\\s+", " ").strip();
    }

    /**
     * Index of the {@code :} or {@code {} that opens the body, or -1.
     * <p>
     * Only brackets at nesting depth 0 count, and quoted strings and comments are
     * skipped. A colon that ends its line wins over an earlier brace, so
     * {@code for k in {1: 2}:} cuts at the trailing colon. Otherwise the first
     * candidate wins.
     */
    static int bodyOpener(String text) {
        int depth = 0;
        int first = -1;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(text, i);
                continue;
            }
            if (c == '#' || text.startsWith("//", i)) {
                i = lineEnd(text, i);
                continue;
            }
            if (text.startsWith("/*", i)) {
                int close = text.indexOf("*/", i + 2);
                i = close < 0 ? text.length() : close + 2;
                continue;
            }
            if (depth == 0 && (c == '{' || c == ':')) {
                if (endsLine(text, i + 1)) {
                    return c == ':' || first < 0 ? i : first;
                }
                if (first < 0) {
                    first = i;
                }
            }
            switch (c) {
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            i++;
        }
        return first;
    }

    private static int skipQuoted(String text, int open) {
        char quote = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || (c == '\n' && quote != '`')) {
                return i + 1;
            }
            i++;
        }
        return i;
    }

    private static int lineEnd(String text, int from) {
        int newline = text.indexOf('\n', from);
        return newline < 0 ? text.length() : newline;
    }

    /** True when only blanks or a line comment follow {@code from} on its line. */
    private static boolean endsLine(String text, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '#' || text.startsWith("//", i)) {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
            i++;
        }
        return true;
    }

    private String findIdentifier(SyntaxNode node) {
        List<String> identifierTypes = adapter.identifierTypes();
        for (String type : identifierTypes) {
            for (int i = 0; i < node.childCount(); i++) {
                SyntaxNode child = node.child(i);
                if (type.equals(child.rawType())) {
                    return child.text();
                }
            }
        }
        return findDescendant(node, identifierTypes).map(SyntaxNode::text).orElse("");
    }

    private String findProperty(SyntaxNode node) {
        Optional<SyntaxNode> field = node.childByField("property")
                .or(() -> node.childByField("attribute"))
                .or(() -> node.childByField("field"));
        if (field.isPresent()) {
            return field.get().text();
        }
        for (int i = node.childCount() - 1; i >= 0; i--) {
            SyntaxNode child = node.child(i);
            if (PROPERTY_TYPES.contains(child.rawType())) {
                return child.text();
            }
        }
        return lastIdentifierChild(node).orElseGet(() -> findIdentifier(node));
    }

    private Optional<String> lastIdentifierChild(SyntaxNode node) {
        for (int i = node.childCount() - 1; i >= 0; i--) {
            SyntaxNode child = node.child(i);
            if (adapter.identifierTypes().contains(child.rawType())) {
                return Optional.of(child.text());
            }
        }
        return Optional.empty();
    }

    private String findQualified(SyntaxNode node) {
        for (int i = 0; i < node.childCount(); i++) {
            SyntaxNode child = node.child(i);
            if (adapter.qualifiedNameTypes().contains(child.rawType())) {
                return child.text();
            }
        }
        if (adapter.qualifiedNameTypes().contains(node.rawType())) {
            return node.text();
        }
        return findIdentifier(node);
    }

    private String findInDeclarator(SyntaxNode node) {
        for (int i = 0; i < node.childCount(); i++) {
            SyntaxNode child = node.child(i);
            if (child.rawType().endsWith("declarator")) {
                return findIdentifier(child);
            }
        }
        return findIdentifier(node);
    }

    private String findAssignmentTarget(SyntaxNode node) {
        Optional<SyntaxNode> left = node.childByField("left")
                .or(() -> node.namedChildren().stream().findFirst());
        if (left.isEmpty()) {
            return "";
        }
        SyntaxNode target = left.get();
        if (adapter.identifierTypes().contains(target.rawType())
                || adapter.qualifiedNameTypes().contains(target.rawType())) {
            return target.text();
        }
        return findIdentifier(target);
    }

    private String findCallTarget(SyntaxNode node) {
        Optional<SyntaxNode> callee = node.childByField("function")
                .or(() -> node.childByField("constructor"))
                .or(() -> node.namedChildren().stream().findFirst());
        return callee.map(SyntaxNode::text).orElse("");
    }

    /**
     * Pre-order search below {@code root}, which itself is not considered.
     */
    static Optional<SyntaxNode> findDescendant(SyntaxNode root, List<String> types) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        pushChildren(stack, root);
        while (!stack.isEmpty()) {
            SyntaxNode current = stack.pop();
            if (types.contains(current.rawType())) {
                return Optional.of(current);
            }
            pushChildren(stack, current);
        }
        return Optional.empty();
    }

    private static void pushChildren(Deque<SyntaxNode> stack, SyntaxNode node) {
        for (int i = node.childCount() - 1; i >= 0; i--) {
            stack.push(node.child(i));
        }
    }
}
