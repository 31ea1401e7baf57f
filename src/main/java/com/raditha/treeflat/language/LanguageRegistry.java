package com.raditha.treeflat.language;

import com.raditha.treeflat.registry.NodeConfigRegistry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Supported languages, their node type tables and the lookup by name, alias or
 * file extension. Built once and read only afterwards.
 */
public final class LanguageRegistry {

    private final Map<String, LanguageAdapter> byName = new LinkedHashMap<>();
    private final Map<String, LanguageAdapter> byExtension = new HashMap<>();
    private final NodeConfigRegistry configs;

    /**
     * @throws IllegalArgumentException if an adapter has no node type table
     */
    public LanguageRegistry(List<LanguageAdapter> adapters, NodeConfigRegistry configs) {
        for (LanguageAdapter adapter : adapters) {
            if (configs.size(adapter.name()) == 0) {
                throw new IllegalArgumentException("No node types configured for " + adapter.name());
            }
            byName.put(adapter.name(), adapter);
            for (String alias : adapter.aliases()) {
                byName.putIfAbsent(alias, adapter);
            }
            for (String extension : adapter.extensions()) {
                byExtension.put(extension.toLowerCase(Locale.ROOT), adapter);
            }
        }
        this.configs = configs;
    }

    /**
     * The shipped languages, with their tables loaded from the classpath.
     */
    public static LanguageRegistry defaults() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        private static final LanguageRegistry INSTANCE = create();

        private static LanguageRegistry create() {
            List<LanguageAdapter> adapters = List.of(new PythonAdapter(), new JavaScriptAdapter(), new JavaAdapter());
            return new LanguageRegistry(adapters, NodeConfigRegistry.load(adapters.stream().map(LanguageAdapter::name).toList()));
        }
    }

    /**
     * Finds a language by canonical name or alias, ignoring case.
     */
    public Optional<LanguageAdapter> find(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(nameOrAlias.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Detects the language of a file from its extension, ignoring case.
     */
    public Optional<LanguageAdapter> detect(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExtension.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
    }

    /**
     * Canonical names of all languages, in registration order.
     */
    public List<String> supportedLanguages() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, LanguageAdapter> entry : byName.entrySet()) {
            if (entry.getKey().equals(entry.getValue().name())) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    public List<LanguageAdapter> adapters() {
        return byName.values().stream().distinct().toList();
    }

    public NodeConfigRegistry configs() {
        return configs;
    }
}
