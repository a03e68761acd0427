package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Horizontal bar drawn over ({@code top}) or under the base.
 */
public final class Bar implements MarkupNode {
    public final MarkupNode base;
    public final boolean top;

    public Bar(MarkupNode base, boolean top) {
        this.base = base;
        this.top = top;
    }

    @Override
    public String kind() {
        return "bar";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(base);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("base", base);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitBar(this, arg);
    }
}
