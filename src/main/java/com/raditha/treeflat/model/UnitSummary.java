package com.raditha.treeflat.model;

/**
 * Outcome of one unit in a batch.
 *
 * @param filePath  unit path, null for in-memory text
 * @param language  resolved language, null when detection failed
 * @param firstId   id of the unit's first record
 * @param nodeCount number of records the unit contributed
 * @param error     diagnostic when the unit was replaced by or ends with an error node, otherwise null
 */
public record UnitSummary(String filePath, String language, long firstId, int nodeCount, String error) {

    public boolean failed() {
        return error != null;
    }
}
