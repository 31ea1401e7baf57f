package com.raditha.treeflat.batch;

import com.raditha.treeflat.config.ExtractionConfig;
import com.raditha.treeflat.config.InvalidParameterException;
import com.raditha.treeflat.config.Parameters;
import com.raditha.treeflat.config.ReadOptions;
import com.raditha.treeflat.config.TreeflatSettings;
import com.raditha.treeflat.flatten.NodeExtractionException;
import com.raditha.treeflat.flatten.TreeFlattener;
import com.raditha.treeflat.frontend.SourceParseException;
import com.raditha.treeflat.frontend.SyntaxFrontEnd;
import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.language.LanguageAdapter;
import com.raditha.treeflat.language.LanguageRegistry;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.AstResultSet;
import com.raditha.treeflat.model.UnitSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Reads a set of units into one record stream.
 * <p>
 * Every unit gets its own front end, created for the unit and closed after it,
 * so no parser state survives from one unit or call to the next. Ids of each unit
 * are shifted by the number of records already produced, which keeps them unique
 * across the whole call.
 * <p>
 * Parse and extraction failures always become an error node for the unit. A tree
 * the grammar recovered is kept and followed by one error node. A unit
 * that cannot be read, or whose language cannot be determined, aborts the call
 * unless errors are ignored. Invariant violations are never recovered.
 */
public class BatchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    private final LanguageRegistry languages;
    private final ErrorNodeFactory errors = new ErrorNodeFactory();

    public BatchCoordinator() {
        this(LanguageRegistry.defaults());
    }

    public BatchCoordinator(LanguageRegistry languages) {
        this.languages = languages;
    }

    /**
     * Reads all units and returns the combined records.
     *
     * @param units    files to read, in order
     * @param language language name or alias, or {@code auto} / {@code null} to detect by extension
     * @param options  validated read options
     * @throws UnitFailureException      if a unit cannot be read and errors are not ignored
     * @throws InvalidParameterException if the language is not supported
     */
    public AstResultSet read(List<Path> units, String language, ReadOptions options) throws UnitFailureException {
        List<AstNode> nodes = new ArrayList<>();
        List<UnitSummary> summaries = readInBatches(units, language, options, nodes::addAll);
        return new AstResultSet(nodes, summaries);
    }

    /**
     * Reads the units and hands their records to a consumer, {@code batchSize}
     * units at a time. Records already delivered stay delivered when a later unit
     * aborts the call.
     *
     * @return per unit outcomes, in input order
     */
    public List<UnitSummary> readInBatches(List<Path> units, String language, ReadOptions options,
                                           Consumer<List<AstNode>> sink) throws UnitFailureException {
        Optional<LanguageAdapter> fixed = selectLanguage(language);
        List<UnitSummary> summaries = new ArrayList<>(units.size());
        List<AstNode> pending = new ArrayList<>();
        int unitsInBatch = 0;
        long offset = 0;

        for (Path unit : units) {
            UnitResult result = readUnit(unit, fixed, options);
            summaries.add(new UnitSummary(unit.toString(), result.language(), offset, result.nodes().size(), result.error()));
            for (AstNode node : result.nodes()) {
                pending.add(node.withIdOffset(offset));
            }
            offset += result.nodes().size();

            if (++unitsInBatch == options.batchSize()) {
                sink.accept(List.copyOf(pending));
                pending.clear();
                unitsInBatch = 0;
            }
        }
        if (unitsInBatch > 0) {
            sink.accept(List.copyOf(pending));
        }
        logger.info("Read {} units into {} nodes", units.size(), offset);
        return summaries;
    }

    /**
     * Parses text that did not come from a file. Records carry no file path.
     *
     * @param language language name or alias; detection is not possible here
     * @throws InvalidParameterException if the language is missing or not supported
     */
    public AstResultSet parseText(String source, String language, ReadOptions options) {
        LanguageAdapter adapter = selectLanguage(language).orElseThrow(() -> unknownLanguage(language));
        UnitResult result = parseUnit(source == null ? "" : source, adapter, null, options.extraction());
        return new AstResultSet(result.nodes(),
                List.of(new UnitSummary(null, adapter.name(), 0, result.nodes().size(), result.error())));
    }

    private Optional<LanguageAdapter> selectLanguage(String language) {
        if (language == null || language.isBlank() || TreeflatSettings.AUTO_LANGUAGE.equalsIgnoreCase(language.trim())) {
            return Optional.empty();
        }
        return Optional.of(languages.find(language).orElseThrow(() -> unknownLanguage(language)));
    }

    private InvalidParameterException unknownLanguage(String language) {
        return new InvalidParameterException(Parameters.LANGUAGE, String.valueOf(language), languages.supportedLanguages());
    }

    private record UnitResult(String language, List<AstNode> nodes, String error) {
    }

    private UnitResult readUnit(Path unit, Optional<LanguageAdapter> fixed, ReadOptions options)
            throws UnitFailureException {
        String filePath = unit.toString();
        Optional<LanguageAdapter> adapter = fixed.isPresent() ? fixed : languages.detect(unit);
        if (adapter.isEmpty()) {
            return failUnit(filePath, null, "Cannot determine language of " + filePath, null, options);
        }

        String source;
        try {
            source = Files.readString(unit, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return failUnit(filePath, adapter.get().name(), "Cannot read " + filePath + ": " + e.getMessage(), e, options);
        }
        logger.debug("Parsing {} as {}", filePath, adapter.get().name());
        return parseUnit(source, adapter.get(), filePath, options.extraction());
    }

    private UnitResult failUnit(String filePath, String language, String message, Throwable cause, ReadOptions options)
            throws UnitFailureException {
        if (!options.ignoreErrors()) {
            throw new UnitFailureException(filePath, message, cause);
        }
        logger.warn("Skipping unit: {}", message);
        return new UnitResult(language, List.of(errors.makeError(message, filePath, language)), message);
    }

    /**
     * Keeps a recovered tree and closes it with one error node that lists the
     * problems, so a scan for PARSE_ERROR still finds the unit.
     */
    private UnitResult withTrailingError(List<AstNode> tree, List<String> problems, LanguageAdapter adapter,
                                         String filePath) {
        String message = "Parse recovered from: " + String.join("; ", problems);
        logger.warn("Keeping partial tree of {}: {}", filePath == null ? adapter.name() + " text" : filePath, message);
        List<AstNode> nodes = new ArrayList<>(tree.size() + 1);
        nodes.addAll(tree);
        nodes.add(errors.makeError(message, filePath, adapter.name()).withIdOffset(tree.size()));
        return new UnitResult(adapter.name(), nodes, message);
    }

    private UnitResult parseUnit(String source, LanguageAdapter adapter, String filePath, ExtractionConfig config) {
        try (SyntaxFrontEnd frontEnd = adapter.newFrontEnd()) {
            SyntaxNode root = frontEnd.parse(source);
            List<AstNode> nodes = new TreeFlattener(adapter, languages.configs(), config).flatten(root, filePath);
            List<String> problems = frontEnd.recoveredProblems();
            if (problems.isEmpty()) {
                return new UnitResult(adapter.name(), nodes, null);
            }
            return withTrailingError(nodes, problems, adapter, filePath);
        } catch (SourceParseException | NodeExtractionException e) {
            String where = filePath == null ? adapter.name() + " text" : filePath;
            logger.warn("Replacing {} by an error node: {}", where, e.getMessage());
            return new UnitResult(adapter.name(),
                    List.of(errors.makeError(e.getMessage(), filePath, adapter.name())), e.getMessage());
        }
    }
}
