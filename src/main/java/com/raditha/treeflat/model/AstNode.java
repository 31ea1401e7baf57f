package com.raditha.treeflat.model;

/**
 * One row of the flattened node table.
 * <p>
 * Every field except {@code id}, {@code rawType} and {@code language} may be
 * {@code null}, either because the detail level suppressed it or because the row
 * is an error node. Ids are unique within a result set and follow pre-order.
 *
 * @param id              unique id, assigned in pre-order
 * @param rawType         grammar specific node type
 * @param normalizedType  name of the semantic type
 * @param name            extracted display name
 * @param semanticType    semantic type code including variant bits
 * @param flags           node flag bitset
 * @param filePath        unit the node came from, null for in-memory units
 * @param language        language of the unit
 * @param startLine       1-based start line
 * @param startColumn     1-based start column
 * @param endLine         1-based end line
 * @param endColumn       1-based exclusive end column
 * @param parentId        parent id, null for roots
 * @param depth           0 for roots
 * @param siblingIndex    position among the parent's children
 * @param childrenCount   number of direct children
 * @param descendantCount number of nodes below this one
 * @param preview         shortened source text, or the diagnostic of an error node
 * @param nativeContext   language specific detail, only at the native context level
 */
public record AstNode(
        long id,
        String rawType,
        String normalizedType,
        String name,
        Integer semanticType,
        Integer flags,
        String filePath,
        String language,
        Integer startLine,
        Integer startColumn,
        Integer endLine,
        Integer endColumn,
        Long parentId,
        Integer depth,
        Integer siblingIndex,
        Integer childrenCount,
        Integer descendantCount,
        String preview,
        NativeContext nativeContext) {

    /**
     * Copy with the id and parent id shifted, used when units are concatenated.
     */
    public AstNode withIdOffset(long offset) {
        if (offset == 0) {
            return this;
        }
        return new AstNode(id + offset, rawType, normalizedType, name, semanticType, flags,
                filePath, language, startLine, startColumn, endLine, endColumn,
                parentId == null ? null : parentId + offset,
                depth, siblingIndex, childrenCount, descendantCount, preview, nativeContext);
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
