package com.raditha.treeflat.language;

import com.raditha.treeflat.extraction.CustomNameExtractor;
import com.raditha.treeflat.extraction.NativeContextExtractor;
import com.raditha.treeflat.frontend.SyntaxFrontEnd;
import com.raditha.treeflat.registry.NativeStrategy;

import java.util.List;
import java.util.Optional;

/**
 * Everything the flattener needs to know about one language. The raw type table
 * lives in {@code registry/<name>.yml}; the adapter supplies the front end and the
 * callbacks that a table cannot express.
 */
public interface LanguageAdapter {

    /** Canonical lower case name, also the name of the registry table. */
    String name();

    List<String> aliases();

    /** File extensions without the dot. */
    List<String> extensions();

    /**
     * Creates a front end for exactly one unit. Callers close it when the unit is done.
     */
    SyntaxFrontEnd newFrontEnd();

    /**
     * Raw types that hold a plain identifier, in search priority order.
     */
    List<String> identifierTypes();

    /**
     * Raw types that hold a dotted or scoped name.
     */
    List<String> qualifiedNameTypes();

    Optional<CustomNameExtractor> customExtractor(String rawType);

    Optional<NativeContextExtractor> nativeExtractor(NativeStrategy strategy);
}
