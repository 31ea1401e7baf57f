package com.raditha.treeflat.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Expands file patterns into unit paths. Plain paths are passed through unchanged,
 * even when they do not exist, so that a missing file surfaces as a unit failure.
 * Glob patterns ({@code src/**}{@code /*.py}) are matched below their longest
 * literal prefix and the matches are returned sorted.
 */
public class PatternResolver {

    private static final Logger logger = LoggerFactory.getLogger(PatternResolver.class);

    private static final String GLOB_CHARS = "*?[{";

    public List<Path> resolve(List<String> patterns) throws IOException {
        Set<Path> units = new LinkedHashSet<>();
        for (String pattern : patterns) {
            if (!isGlob(pattern)) {
                units.add(Path.of(pattern));
                continue;
            }
            List<Path> matches = expand(pattern);
            if (matches.isEmpty()) {
                logger.warn("No files match {}", pattern);
            }
            units.addAll(matches);
        }
        return new ArrayList<>(units);
    }

    static boolean isGlob(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private List<Path> expand(String pattern) throws IOException {
        String normalized = pattern.replace('\\', '/');
        int firstGlob = 0;
        while (firstGlob < normalized.length() && GLOB_CHARS.indexOf(normalized.charAt(firstGlob)) < 0) {
            firstGlob++;
        }
        int slash = normalized.lastIndexOf('/', firstGlob);
        Path base = slash < 0 ? Path.of(".") : Path.of(slash == 0 ? "/" : normalized.substring(0, slash));
        String relativeGlob = slash < 0 ? normalized : normalized.substring(slash + 1);

        if (!Files.isDirectory(base)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + relativeGlob);
        try (Stream<Path> files = Files.walk(base)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> matcher.matches(base.relativize(file)))
                    .map(file -> slash < 0 ? base.relativize(file) : file)
                    .sorted()
                    .toList();
        }
    }
}
