package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * One element of a math markup tree.
 * <p>
 * Every variant lists its children as ordered <em>slots</em>. A slot may be {@code null}
 * when the source markup omitted that child; converters treat such a slot as empty content.
 * Nodes are immutable and own their children exclusively.
 */
public interface MarkupNode {

    /**
     * Short variant name used in advisories, e.g. {@code fraction}.
     */
    String kind();

    /**
     * Children in conversion order. Never null, elements may be null.
     */
    List<MarkupNode> slots();

    /**
     * Names of required slots that are absent. Empty for a well-formed node.
     */
    default List<String> missingParts() {
        return List.of();
    }

    <R, A> R accept(MarkupVisitor<R, A> visitor, A arg);
}
