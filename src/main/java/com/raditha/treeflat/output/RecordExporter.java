package com.raditha.treeflat.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.model.AstResultSet;
import com.raditha.treeflat.model.NativeContext;
import com.raditha.treeflat.model.UnitSummary;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes the node table as CSV or JSON, together with a summary of the run.
 */
public class RecordExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    public static final List<String> COLUMNS = List.of(
            "id", "raw_type", "normalized_type", "name", "semantic_type", "flags",
            "file_path", "language", "start_line", "start_column", "end_line", "end_column",
            "parent_id", "depth", "sibling_index", "children_count", "descendant_count", "preview");

    public static final List<String> NATIVE_COLUMNS = List.of(
            "signature_type", "parameters", "modifiers", "defaults", "qualified_name");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean includeNative;

    /**
     * @param includeNative add the native context columns, used when the context level is native
     */
    public RecordExporter(boolean includeNative) {
        this.includeNative = includeNative;
    }

    /**
     * Totals of one read.
     */
    public record RunSummary(
            LocalDateTime timestamp,
            int units,
            int failedUnits,
            int nodes,
            long errors,
            int maxDepth,
            Set<String> languages,
            List<UnitSummary> unitResults) {
    }

    public RunSummary summarize(AstResultSet result) {
        int failed = (int) result.units().stream().filter(UnitSummary::failed).count();
        return new RunSummary(
                LocalDateTime.now(),
                result.units().size(),
                failed,
                result.nodeCount(),
                result.errorCount(),
                result.maxDepth(),
                result.languages(),
                result.units());
    }

    /**
     * One line description of a run for the console.
     */
    public String describe(RunSummary summary) {
        return String.format("%s: %d units (%d failed), %d nodes, %d error nodes, max depth %d, languages [%s]",
                summary.timestamp().format(TIMESTAMP_FORMAT),
                summary.units(),
                summary.failedUnits(),
                summary.nodes(),
                summary.errors(),
                summary.maxDepth(),
                String.join(", ", summary.languages()));
    }

    public List<String> header() {
        List<String> header = new ArrayList<>(COLUMNS);
        if (includeNative) {
            header.addAll(NATIVE_COLUMNS);
        }
        return header;
    }

    /**
     * Writes a header and one row per node. Null fields are written as empty cells.
     */
    public void writeCsv(List<AstNode> nodes, Writer out) throws IOException {
        out.write(csvLine(header()));
        for (AstNode node : nodes) {
            out.write(csvLine(row(node).values().stream().map(RecordExporter::csvValue).toList()));
        }
        out.flush();
    }

    public void exportToCsv(AstResultSet result, Path outputPath) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            writeCsv(result.nodes(), writer);
        }
    }

    /**
     * Writes the nodes as a JSON array of objects keyed by column name. Null
     * fields are kept so every object has the same keys.
     */
    public void writeJson(List<AstNode> nodes, Writer out) throws IOException {
        List<Map<String, Object>> rows = nodes.stream().map(this::row).toList();
        out.write(toJson(rows));
        out.write(System.lineSeparator());
        out.flush();
    }

    public void exportToJson(AstResultSet result, Path outputPath) throws IOException {
        try (Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            writeJson(result.nodes(), writer);
        }
    }

    public void exportSummary(RunSummary summary, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(summary), StandardCharsets.UTF_8);
    }

    private static String toJson(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    /**
     * Column name to value, in column order.
     */
    Map<String, Object> row(AstNode node) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", node.id());
        row.put("raw_type", node.rawType());
        row.put("normalized_type", node.normalizedType());
        row.put("name", node.name());
        row.put("semantic_type", node.semanticType());
        row.put("flags", node.flags());
        row.put("file_path", node.filePath());
        row.put("language", node.language());
        row.put("start_line", node.startLine());
        row.put("start_column", node.startColumn());
        row.put("end_line", node.endLine());
        row.put("end_column", node.endColumn());
        row.put("parent_id", node.parentId());
        row.put("depth", node.depth());
        row.put("sibling_index", node.siblingIndex());
        row.put("children_count", node.childrenCount());
        row.put("descendant_count", node.descendantCount());
        row.put("preview", node.preview());
        if (includeNative) {
            NativeContext ctx = node.nativeContext();
            row.put("signature_type", ctx == null ? null : ctx.signatureType());
            row.put("parameters", ctx == null ? null : ctx.parameters());
            row.put("modifiers", ctx == null ? null : ctx.modifiers());
            row.put("defaults", ctx == null ? null : ctx.defaults());
            row.put("qualified_name", ctx == null ? null : ctx.qualifiedName());
        }
        return row;
    }

    private static String csvValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return list.stream().map(RecordExporter::listItem).collect(Collectors.joining(";"));
        }
        return value.toString();
    }

    /**
     * Parameters are written as {@code name:type=default}, leaving out missing parts.
     */
    private static String listItem(Object item) {
        if (item instanceof NativeContext.Parameter p) {
            StringBuilder text = new StringBuilder(p.name() == null ? "" : p.name());
            if (p.type() != null) {
                text.append(':').append(p.type());
            }
            if (p.defaultValue() != null) {
                text.append('=').append(p.defaultValue());
            }
            return text.toString();
        }
        return String.valueOf(item);
    }

    static String csvLine(List<String> cells) {
        return cells.stream().map(RecordExporter::quote).collect(Collectors.joining(",")) + "\r\n";
    }

    static String quote(String cell) {
        boolean needsQuotes = cell.chars().anyMatch(c -> c == ',' || c == '"' || c == '\n' || c == '\r');
        if (!needsQuotes) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
