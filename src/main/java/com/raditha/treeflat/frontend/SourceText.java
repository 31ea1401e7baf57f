package com.raditha.treeflat.frontend;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 view of a unit's source, sliced by the byte offsets tree-sitter reports.
 */
public final class SourceText {

    private final byte[] bytes;

    public SourceText(String source) {
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    public String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, length()));
        int end = Math.max(start, Math.min(endByte, length()));
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /** Length in bytes. */
    public int length() {
        return bytes.length;
    }
}
