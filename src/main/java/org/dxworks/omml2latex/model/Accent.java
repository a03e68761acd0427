package org.dxworks.omml2latex.model;

import java.util.List;

public final class Accent implements MarkupNode {
    /** Accent mark, or null for the markup default (circumflex). */
    public final String accentChar;
    public final MarkupNode base;

    public Accent(String accentChar, MarkupNode base) {
        this.accentChar = accentChar;
        this.base = base;
    }

    @Override
    public String kind() {
        return "accent";
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
        return visitor.visitAccent(this, arg);
    }
}
