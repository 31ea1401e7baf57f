package com.raditha.treeflat.registry;

import com.raditha.treeflat.taxonomy.SemanticTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Raw type to {@link NodeConfig} tables for every supported language.
 * <p>
 * Tables are read from {@code registry/<language>.yml} on the classpath when the
 * registry is built and are never modified afterwards, so lookups need no locking.
 * A malformed table fails the load; there is no partially loaded registry.
 * <pre>
 * nodes:
 *   function_definition:
 *     type: DEFINITION_FUNCTION
 *     name: FIND_IDENTIFIER
 *     preview: SIGNATURE
 *     native: FUNCTION_WITH_PARAMS
 *     flags: [EMBODIED]
 *   "def": {type: NAME_KEYWORD, flags: [KEYWORD]}
 * </pre>
 */
public final class NodeConfigRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NodeConfigRegistry.class);

    private static final String RESOURCE_PREFIX = "registry/";
    private static final String NODES_KEY = "nodes";

    private final Map<String, Map<String, NodeConfig>> tables;

    private NodeConfigRegistry(Map<String, Map<String, NodeConfig>> tables) {
        this.tables = Map.copyOf(tables);
    }

    /**
     * Loads the classpath tables of the given languages.
     *
     * @throws IllegalStateException if a table is missing or malformed
     */
    public static NodeConfigRegistry load(Collection<String> languages) {
        Map<String, Map<String, NodeConfig>> tables = new HashMap<>();
        for (String language : languages) {
            String resource = RESOURCE_PREFIX + language + ".yml";
            try (InputStream in = NodeConfigRegistry.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new IllegalStateException("Node type table not found: " + resource);
                }
                Map<String, NodeConfig> table = parseTable(language, in);
                tables.put(language, table);
                logger.debug("Loaded {} node types for {}", table.size(), language);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + resource, e);
            }
        }
        return new NodeConfigRegistry(tables);
    }

    /**
     * Builds a registry from tables assembled in code.
     */
    public static NodeConfigRegistry of(Map<String, Map<String, NodeConfig>> tables) {
        Map<String, Map<String, NodeConfig>> copy = new HashMap<>();
        tables.forEach((language, table) -> copy.put(language, Map.copyOf(table)));
        return new NodeConfigRegistry(copy);
    }

    /**
     * Parses one YAML table.
     *
     * @throws IllegalStateException if an entry names an unknown type, strategy or flag
     */
    public static Map<String, NodeConfig> parseTable(String language, InputStream in) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new SafeConstructor(options));
        Object document;
        try {
            document = yaml.load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed node type table for " + language + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map<?, ?> root) || !(root.get(NODES_KEY) instanceof Map<?, ?> nodes)) {
            throw new IllegalStateException("Node type table for " + language + " has no '" + NODES_KEY + "' map");
        }

        Map<String, NodeConfig> table = new HashMap<>();
        for (Map.Entry<?, ?> entry : nodes.entrySet()) {
            if (!(entry.getKey() instanceof String rawType)) {
                throw new IllegalStateException("Node type table for " + language
                        + " has a non string key: " + entry.getKey() + " (quote it)");
            }
            if (!(entry.getValue() instanceof Map<?, ?> fields)) {
                throw new IllegalStateException(language + "/" + rawType + ": entry must be a map");
            }
            try {
                table.put(rawType, toConfig(fields));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(language + "/" + rawType + ": " + e.getMessage(), e);
            }
        }
        return table;
    }

    private static NodeConfig toConfig(Map<?, ?> fields) {
        String typeName = getString(fields, "type", null);
        if (typeName == null) {
            throw new IllegalArgumentException("missing type");
        }
        int code = SemanticTypes.resolve(typeName)
                .orElseThrow(() -> new IllegalArgumentException("unknown semantic type " + typeName));

        return new NodeConfig(
                code,
                NameStrategy.valueOf(getString(fields, "name", NameStrategy.NONE.name()).toUpperCase(Locale.ROOT)),
                PreviewStrategy.valueOf(getString(fields, "preview", PreviewStrategy.DEFAULT.name()).toUpperCase(Locale.ROOT)),
                NativeStrategy.valueOf(getString(fields, "native", NativeStrategy.NONE.name()).toUpperCase(Locale.ROOT)),
                NodeFlags.parse(getListString(fields, "flags")));
    }

    private static String getString(Map<?, ?> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getListString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    /**
     * Configuration of a raw type, or empty when the language table has no entry.
     * Callers decide the fallback, normally {@link NodeConfig#opaque()}.
     */
    public Optional<NodeConfig> lookup(String language, String rawType) {
        Map<String, NodeConfig> table = tables.get(language);
        if (table == null || rawType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(rawType));
    }

    public Set<String> languages() {
        return tables.keySet();
    }

    public int size(String language) {
        Map<String, NodeConfig> table = tables.get(language);
        return table == null ? 0 : table.size();
    }
}
