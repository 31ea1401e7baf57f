package com.raditha.treeflat.cli;

import com.raditha.treeflat.batch.BatchCoordinator;
import com.raditha.treeflat.batch.PatternResolver;
import com.raditha.treeflat.batch.UnitFailureException;
import com.raditha.treeflat.config.Parameters;
import com.raditha.treeflat.config.ReadOptions;
import com.raditha.treeflat.config.TreeflatSettings;
import com.raditha.treeflat.language.LanguageAdapter;
import com.raditha.treeflat.language.LanguageRegistry;
import com.raditha.treeflat.model.AstResultSet;
import com.raditha.treeflat.output.RecordExporter;
import com.raditha.treeflat.taxonomy.SemanticType;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for reading source files into a flat node table.
 * <p>
 * Usage:
 * java -jar treeflat.jar [options] &lt;file-or-pattern&gt;...
 * <p>
 * Configuration priority: CLI arguments > treeflat.yml > defaults
 */
@Command(name = "treeflat", mixinStandardHelpOptions = true, version = "Treeflat v1.0.0",
        description = "Flattens syntax trees of source files into one language neutral node table")
@SuppressWarnings("java:S106")
public class TreeflatCLI implements Callable<Integer> {

    @CommandLine.Parameters(paramLabel = "<pattern>", arity = "0..*",
            description = "Files or glob patterns such as 'src/**/*.py'")
    private List<String> patterns = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--language", description = "Language name or alias, or 'auto' to detect by extension", paramLabel = "<name>")
    private String language;

    @Option(names = "--text", description = "Parse this text instead of files (needs --language)", paramLabel = "<source>")
    private String text;

    @Option(names = "--context", description = "none, node_types_only, normalized or native (default: native)", paramLabel = "<level>")
    private String context;

    @Option(names = "--source", description = "none, path, lines_only, lines or full (default: lines)", paramLabel = "<level>")
    private String source;

    @Option(names = "--structure", description = "none, minimal or full (default: full)", paramLabel = "<level>")
    private String structure;

    @Option(names = "--preview", description = "none, smart, full or a character limit (default: smart)", paramLabel = "<mode>")
    private String preview;

    @Option(names = "--batch-size", description = "Units per output batch (default: 1)", paramLabel = "<n>")
    private String batchSize;

    @Option(names = "--ignore-errors", description = "Replace unreadable units by error nodes instead of failing")
    private Boolean ignoreErrors;

    @Option(names = "--format", description = "Output format: csv or json (default: csv)", paramLabel = "<format>",
            converter = OutputFormatConverter.class)
    private OutputFormat format = OutputFormat.CSV;

    @Option(names = "--output", description = "Write the table to a file instead of stdout", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--summary", description = "Also write a JSON run summary to this file", paramLabel = "<path>")
    private String summaryPath;

    @Option(names = "--list-languages", description = "List supported languages and exit")
    private boolean listLanguages = false;

    @Option(names = "--list-types", description = "List the semantic type taxonomy and exit")
    private boolean listTypes = false;

    @Override
    public Integer call() throws Exception {
        if (listLanguages) {
            printLanguages();
            return 0;
        }
        if (listTypes) {
            printTypes();
            return 0;
        }
        validateConfiguration();

        TreeflatSettings settings = configFile != null
                ? TreeflatSettings.load(Path.of(configFile))
                : TreeflatSettings.loadDefault(Path.of("."));
        ReadOptions options = settings.resolve(overrides());
        String selectedLanguage = settings.language(language);

        AstResultSet result = read(selectedLanguage, options);

        RecordExporter exporter = new RecordExporter(options.extraction().context().includesNative());
        writeTable(exporter, result);

        RecordExporter.RunSummary summary = exporter.summarize(result);
        if (summaryPath != null) {
            exporter.exportSummary(summary, Path.of(summaryPath));
        }
        System.err.println(exporter.describe(summary));
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new TreeflatCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException || ex instanceof UnitFailureException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (text == null && patterns.isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }
        if (text != null && !patterns.isEmpty()) {
            throw new IllegalArgumentException("Cannot use --text together with input files");
        }
        if (configFile != null && !Files.isRegularFile(Path.of(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (outputPath != null && Files.isDirectory(Path.of(outputPath))) {
            throw new IllegalArgumentException("Output path is a directory: " + outputPath);
        }
    }

    private Map<String, String> overrides() {
        Map<String, String> values = new HashMap<>();
        putIfSet(values, Parameters.CONTEXT, context);
        putIfSet(values, Parameters.SOURCE, source);
        putIfSet(values, Parameters.STRUCTURE, structure);
        putIfSet(values, Parameters.PREVIEW, preview);
        putIfSet(values, Parameters.BATCH_SIZE, batchSize);
        putIfSet(values, Parameters.IGNORE_ERRORS, ignoreErrors == null ? null : ignoreErrors.toString());
        return values;
    }

    private static void putIfSet(Map<String, String> values, String key, String value) {
        if (value != null) {
            values.put(key, value);
        }
    }

    private AstResultSet read(String selectedLanguage, ReadOptions options) throws IOException, UnitFailureException {
        BatchCoordinator coordinator = new BatchCoordinator();
        if (text != null) {
            return coordinator.parseText(text, selectedLanguage, options);
        }
        List<Path> units = new PatternResolver().resolve(patterns);
        if (units.isEmpty()) {
            System.err.println("No files found matching " + String.join(" ", patterns));
        }
        return coordinator.read(units, selectedLanguage, options);
    }

    private void writeTable(RecordExporter exporter, AstResultSet result) throws IOException {
        if (outputPath != null) {
            Path path = Path.of(outputPath);
            if (format == OutputFormat.JSON) {
                exporter.exportToJson(result, path);
            } else {
                exporter.exportToCsv(result, path);
            }
            System.err.println("Wrote " + result.nodeCount() + " nodes to " + path);
            return;
        }
        // stdout stays open for the caller
        Writer out = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
        if (format == OutputFormat.JSON) {
            exporter.writeJson(result.nodes(), out);
        } else {
            exporter.writeCsv(result.nodes(), out);
        }
    }

    private void printLanguages() {
        LanguageRegistry registry = LanguageRegistry.defaults();
        for (LanguageAdapter adapter : registry.adapters()) {
            System.out.printf("%-12s aliases: %-12s extensions: %s%n",
                    adapter.name(),
                    String.join(",", adapter.aliases()),
                    String.join(",", adapter.extensions()));
        }
    }

    private void printTypes() {
        for (SemanticType type : SemanticType.values()) {
            System.out.printf("0x%02X  %-28s %-18s %-16s %s%n",
                    type.code(),
                    type.name(),
                    type.kind(),
                    type.superKind(),
                    String.join(",", type.variants()));
        }
    }

    /**
     * Custom converter for OutputFormat enum to handle CLI string values.
     */
    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) throws Exception {
            return OutputFormat.fromString(value);
        }
    }
}
