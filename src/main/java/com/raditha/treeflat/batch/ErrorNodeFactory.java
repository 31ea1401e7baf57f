package com.raditha.treeflat.batch;

import com.raditha.treeflat.model.AstNode;
import com.raditha.treeflat.taxonomy.SemanticType;

/**
 * Builds the record that stands in for a unit that could not be parsed or
 * extracted. Error nodes are ordinary leaves: id 0 before renumbering, the
 * PARSE_ERROR semantic type, no structure fields and the diagnostic as preview.
 * They are not subject to the detail levels, so a scan for PARSE_ERROR finds
 * them whatever the configuration.
 */
public class ErrorNodeFactory {

    public static final String RAW_TYPE = "ERROR";

    public AstNode makeError(String message) {
        return makeError(message, null, null);
    }

    /**
     * Error node carrying the provenance of the failed unit.
     */
    public AstNode makeError(String message, String filePath, String language) {
        return new AstNode(
                0,
                RAW_TYPE,
                SemanticType.PARSE_ERROR.name(),
                null,
                SemanticType.PARSE_ERROR.code(),
                0,
                filePath,
                language,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                null,
                message == null ? "" : message,
                null);
    }
}
