package com.raditha.treeflat.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternResolverTest {

    @TempDir
    Path tempDir;

    private final PatternResolver resolver = new PatternResolver();

    private Path touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
        return file;
    }

    private String pattern(String glob) {
        return tempDir.toString().replace('\\', '/') + "/" + glob;
    }

    @Test
    void testPlainPathsPassThrough() throws IOException {
        Path missing = tempDir.resolve("missing.py");
        assertEquals(List.of(missing), resolver.resolve(List.of(missing.toString())));
    }

    @Test
    void testRecursiveGlob() throws IOException {
        Path top = touch("a.py");
        Path nested = touch("pkg/sub/b.py");
        touch("pkg/c.js");

        List<Path> units = resolver.resolve(List.of(pattern("**.py")));
        assertEquals(List.of(top, nested), units);
    }

    @Test
    void testSingleDirectoryGlob() throws IOException {
        touch("a.py");
        Path js = touch("pkg/c.js");
        touch("pkg/deeper/d.js");

        assertEquals(List.of(js), resolver.resolve(List.of(pattern("pkg/*.js"))));
    }

    @Test
    void testDuplicatesAreRemoved() throws IOException {
        Path file = touch("x.py");
        List<Path> units = resolver.resolve(List.of(pattern("*.py"), pattern("x.py")));
        assertEquals(1, units.size());
        assertEquals(file.toString(), units.get(0).toString());
    }

    @Test
    void testNoMatches() throws IOException {
        assertTrue(resolver.resolve(List.of(pattern("*.rb"))).isEmpty());
        assertTrue(resolver.resolve(List.of(pattern("nowhere/*.py"))).isEmpty());
    }

    @Test
    void testIsGlob() {
        assertTrue(PatternResolver.isGlob("src/**/*.py"));
        assertTrue(PatternResolver.isGlob("file?.js"));
        assertFalse(PatternResolver.isGlob("src/main.py"));
    }
}
