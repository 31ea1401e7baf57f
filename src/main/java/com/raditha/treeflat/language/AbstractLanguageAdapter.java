package com.raditha.treeflat.language;

import com.raditha.treeflat.extraction.CustomNameExtractor;
import com.raditha.treeflat.extraction.NativeContextExtractor;
import com.raditha.treeflat.registry.NativeStrategy;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch tables for CUSTOM name extraction and native context, filled by
 * subclasses in their constructors and read only afterwards.
 */
public abstract class AbstractLanguageAdapter implements LanguageAdapter {

    private final String name;
    private final List<String> aliases;
    private final List<String> extensions;
    private final Map<String, CustomNameExtractor> customExtractors = new HashMap<>();
    private final Map<NativeStrategy, NativeContextExtractor> nativeExtractors = new EnumMap<>(NativeStrategy.class);

    protected AbstractLanguageAdapter(String name, List<String> aliases, List<String> extensions) {
        this.name = name;
        this.aliases = List.copyOf(aliases);
        this.extensions = List.copyOf(extensions);
    }

    protected void registerCustom(String rawType, CustomNameExtractor extractor) {
        customExtractors.put(rawType, extractor);
    }

    protected void registerNative(NativeStrategy strategy, NativeContextExtractor extractor) {
        nativeExtractors.put(strategy, extractor);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> aliases() {
        return aliases;
    }

    @Override
    public List<String> extensions() {
        return extensions;
    }

    @Override
    public Optional<CustomNameExtractor> customExtractor(String rawType) {
        return Optional.ofNullable(customExtractors.get(rawType));
    }

    @Override
    public Optional<NativeContextExtractor> nativeExtractor(NativeStrategy strategy) {
        return Optional.ofNullable(nativeExtractors.get(strategy));
    }

    @Override
    public String toString() {
        return name;
    }
}
