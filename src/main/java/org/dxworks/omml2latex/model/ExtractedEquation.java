package org.dxworks.omml2latex.model;

import org.dxworks.omml2latex.MathMode;

/**
 * One equation found in a document, with its placement and its markup tree.
 */
public final class ExtractedEquation {
    public final int index;
    public final MathMode mode;
    public final MarkupNode root;

    public ExtractedEquation(int index, MathMode mode, MarkupNode root) {
        this.index = index;
        this.mode = mode;
        this.root = root;
    }
}
