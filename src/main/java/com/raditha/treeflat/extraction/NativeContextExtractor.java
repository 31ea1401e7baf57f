package com.raditha.treeflat.extraction;

import com.raditha.treeflat.frontend.SyntaxNode;
import com.raditha.treeflat.model.NativeContext;

/**
 * Language supplied collection of native detail for one node. Same purity rules as
 * {@link CustomNameExtractor}.
 */
@FunctionalInterface
public interface NativeContextExtractor {

    NativeContext extract(SyntaxNode node);
}
