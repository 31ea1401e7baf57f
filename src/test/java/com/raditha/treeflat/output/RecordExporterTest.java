package com.raditha.treeflat.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.treeflat.batch.BatchCoordinator;
import com.raditha.treeflat.config.ReadOptions;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.AstResultSet;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.model.UnitSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RecordExporter - CSV, JSON and summary output.
 */
class RecordExporterTest {

    @TempDir
    Path tempDir;

    private static AstNode function() {
        NativeContext context = new NativeContext(
                "str",
                List.of(new NativeContext.Parameter("self"), new NativeContext.Parameter("x", "int", "3")),
                List.of("async", "@cached"),
                null,
                "Greeter.hello");
        return new AstNode(1, "function_definition", "DEFINITION_FUNCTION", "hello", 0x10, 0,
                "src/greet.py", "python", 1, 1, 2, 9, 0L, 1, 0, 4, 10,
                "def hello(self, x: int = 3) -> str, \"quoted\"", context);
    }

    private static AstNode bareRoot() {
        return new AstNode(0, "module", null, null, null, null,
                null, "python", null, null, null, null, null, null, null, null, null, null, null);
    }

    private static String csv(RecordExporter exporter, List<AstNode> nodes) throws IOException {
        StringWriter out = new StringWriter();
        exporter.writeCsv(nodes, out);
        return out.toString();
    }

    @Test
    void testCsvHeader() throws IOException {
        String plain = csv(new RecordExporter(false), List.of());
        assertEquals(String.join(",", RecordExporter.COLUMNS) + "\r\n", plain);

        String withNative = csv(new RecordExporter(true), List.of());
        assertTrue(withNative.startsWith("id,raw_type,normalized_type,name,"));
        assertTrue(withNative.endsWith("preview,signature_type,parameters,modifiers,defaults,qualified_name\r\n"));
    }

    @Test
    void testNullFieldsAreEmptyCells() throws IOException {
        String[] lines = csv(new RecordExporter(true), List.of(bareRoot())).split("\r\n");

        assertEquals(2, lines.length);
        assertEquals("0,module,,,,,,python" + ",".repeat(15), lines[1]);
    }

    @Test
    void testQuotingAndNativeColumns() throws IOException {
        String[] lines = csv(new RecordExporter(true), List.of(function())).split("\r\n");
        String row = lines[1];

        assertTrue(row.startsWith("1,function_definition,DEFINITION_FUNCTION,hello,16,0,src/greet.py,python,"));
        assertTrue(row.contains("\"def hello(self, x: int = 3) -> str, \"\"quoted\"\"\""));
        assertTrue(row.endsWith(",str,self;x:int=3,async;@cached,,Greeter.hello"));
    }

    @Test
    void testQuote() {
        assertEquals("plain", RecordExporter.quote("plain"));
        assertEquals("\"a,b\"", RecordExporter.quote("a,b"));
        assertEquals("\"line\nbreak\"", RecordExporter.quote("line\nbreak"));
        assertEquals("\"say \"\"hi\"\"\"", RecordExporter.quote("say \"hi\""));
        assertEquals("", RecordExporter.quote(""));
    }

    @Test
    void testJsonKeepsNullsAndOrder() throws IOException {
        StringWriter out = new StringWriter();
        new RecordExporter(true).writeJson(List.of(bareRoot(), function()), out);

        JsonNode array = new ObjectMapper().readTree(out.toString());
        assertTrue(array.isArray());
        assertEquals(2, array.size());

        JsonNode root = array.get(0);
        assertEquals(RecordExporter.COLUMNS.size() + RecordExporter.NATIVE_COLUMNS.size(), root.size());
        assertEquals("id", root.fieldNames().next());
        assertTrue(root.get("name").isNull());
        assertTrue(root.get("parent_id").isNull());

        JsonNode function = array.get(1);
        assertEquals(0, function.get("parent_id").asLong());
        assertEquals("x", function.get("parameters").get(1).get("name").asText());
        assertEquals("3", function.get("parameters").get(1).get("defaultValue").asText());
        assertEquals("@cached", function.get("modifiers").get(1).asText());
    }

    @Test
    void testJsonWithoutNativeColumns() throws IOException {
        StringWriter out = new StringWriter();
        new RecordExporter(false).writeJson(List.of(function()), out);

        JsonNode row = new ObjectMapper().readTree(out.toString()).get(0);
        assertEquals(RecordExporter.COLUMNS.size(), row.size());
        assertFalse(row.has("qualified_name"));
    }

    @Test
    void testExportFilesFromRead() throws IOException {
        AstResultSet result = new BatchCoordinator().parseText("def hello(): pass", "python", ReadOptions.defaults());
        RecordExporter exporter = new RecordExporter(true);

        Path csvPath = tempDir.resolve("nodes.csv");
        exporter.exportToCsv(result, csvPath);
        List<String> lines = Files.readAllLines(csvPath);
        assertEquals(result.nodeCount() + 1, lines.size());

        Path jsonPath = tempDir.resolve("nodes.json");
        exporter.exportToJson(result, jsonPath);
        JsonNode json = new ObjectMapper().readTree(jsonPath.toFile());
        assertEquals(result.nodeCount(), json.size());
        assertEquals("module", json.get(0).get("raw_type").asText());
    }

    @Test
    void testSummary() throws IOException {
        AstResultSet result = new AstResultSet(
                List.of(bareRoot(), function()),
                List.of(new UnitSummary("src/greet.py", "python", 0, 2, null),
                        new UnitSummary("broken.py", "python", 2, 0, "Cannot read broken.py: gone")));
        RecordExporter exporter = new RecordExporter(false);

        RecordExporter.RunSummary summary = exporter.summarize(result);
        assertEquals(2, summary.units());
        assertEquals(1, summary.failedUnits());
        assertEquals(2, summary.nodes());
        assertEquals(0, summary.errors());
        assertEquals(1, summary.maxDepth());

        String line = exporter.describe(summary);
        assertTrue(line.contains("2 units (1 failed), 2 nodes, 0 error nodes, max depth 1, languages [python]"), line);

        Path summaryPath = tempDir.resolve("summary.json");
        exporter.exportSummary(summary, summaryPath);
        JsonNode json = new ObjectMapper().readTree(summaryPath.toFile());
        assertEquals(2, json.get("units").asInt());
        assertTrue(json.get("timestamp").isTextual());
        assertEquals("Cannot read broken.py: gone", json.get("unitResults").get(1).get("error").asText());
    }
}
