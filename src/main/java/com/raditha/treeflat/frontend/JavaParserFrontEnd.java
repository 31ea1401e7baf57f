package com.raditha.treeflat.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.util.List;

/**
 * Front end for Java built on JavaParser. A new {@link JavaParser} is created per
 * instance instead of going through {@code StaticJavaParser}, whose configuration
 * is process wide.
 * <p>
 * JavaParser recovers from broken statements by emitting {@code UnparsableStmt}
 * nodes. Such a tree is returned as is and its problems are reported through
 * {@link #recoveredProblems()}. Only a parse that yields no tree at all throws.
 */
public class JavaParserFrontEnd implements SyntaxFrontEnd {

    private static final int MAX_REPORTED_PROBLEMS = 3;

    private JavaParser parser;
    private List<String> recovered = List.of();

    public JavaParserFrontEnd() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    @Override
    public SyntaxNode parse(String source) throws SourceParseException {
        if (parser == null) {
            throw new IllegalStateException("Front end for java is closed");
        }
        ParseResult<CompilationUnit> result = parser.parse(source);
        List<String> problems = result.getProblems().stream()
                .limit(MAX_REPORTED_PROBLEMS)
                .map(Problem::getVerboseMessage)
                .toList();
        if (result.getResult().isEmpty()) {
            recovered = List.of();
            throw new SourceParseException("Java parse failed: " + String.join("; ", problems));
        }
        recovered = problems;
        return new JavaParserSyntaxNode(result.getResult().get(), null);
    }

    @Override
    public List<String> recoveredProblems() {
        return recovered;
    }

    @Override
    public void close() {
        parser = null;
    }
}
