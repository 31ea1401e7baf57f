package com.raditha.treeflat.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Read options from a YAML file with command line overrides.
 * <pre>
 * read_ast:
 *   context: normalized
 *   source: full
 *   preview: 80
 *   batch_size: 4
 *   ignore_errors: true
 *   language: auto
 * </pre>
 * Configuration priority: CLI arguments > treeflat.yml > defaults
 */
public class TreeflatSettings {

    private static final Logger logger = LoggerFactory.getLogger(TreeflatSettings.class);

    public static final String DEFAULT_FILE = "treeflat.yml";
    public static final String CONFIG_KEY = "read_ast";
    public static final String AUTO_LANGUAGE = "auto";

    private final Map<String, Object> values;

    private TreeflatSettings(Map<String, Object> values) {
        this.values = values;
    }

    public static TreeflatSettings empty() {
        return new TreeflatSettings(Map.of());
    }

    /**
     * Loads the {@code read_ast} section of a YAML file. A file without the
     * section yields empty settings.
     */
    public static TreeflatSettings load(Path file) throws IOException {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object document;
        try (Reader reader = Files.newBufferedReader(file)) {
            document = yaml.load(reader);
        }
        if (document instanceof Map<?, ?> root && root.get(CONFIG_KEY) instanceof Map<?, ?> section) {
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) section;
            logger.debug("Loaded {} settings from {}", config.size(), file);
            return new TreeflatSettings(config);
        }
        logger.debug("No {} section in {}", CONFIG_KEY, file);
        return empty();
    }

    /**
     * Loads {@code treeflat.yml} from a directory if it exists.
     */
    public static TreeflatSettings loadDefault(Path directory) throws IOException {
        Path file = directory.resolve(DEFAULT_FILE);
        return Files.isRegularFile(file) ? load(file) : empty();
    }

    /**
     * Builds read options, taking each parameter from the overrides first, then
     * from the file, then from the defaults.
     *
     * @param overrides parameter values given on the command line, keyed by parameter name
     * @throws InvalidParameterException if any resulting value is invalid
     */
    public ReadOptions resolve(Map<String, String> overrides) {
        return ReadOptions.parse(
                pick(overrides, Parameters.CONTEXT, ReadOptions.DEFAULT_CONTEXT),
                pick(overrides, Parameters.SOURCE, ReadOptions.DEFAULT_SOURCE),
                pick(overrides, Parameters.STRUCTURE, ReadOptions.DEFAULT_STRUCTURE),
                pick(overrides, Parameters.PREVIEW, ReadOptions.DEFAULT_PREVIEW),
                pick(overrides, Parameters.BATCH_SIZE, Integer.toString(ReadOptions.DEFAULT_BATCH_SIZE)),
                pick(overrides, Parameters.IGNORE_ERRORS, "false"));
    }

    public String language(String override) {
        if (override != null) {
            return override;
        }
        Object value = values.get(Parameters.LANGUAGE);
        return value != null ? value.toString() : AUTO_LANGUAGE;
    }

    private String pick(Map<String, String> overrides, String key, String defaultValue) {
        String override = overrides.get(key);
        if (override != null) {
            return override;
        }
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
