package org.dxworks.omml2latex.model;

import java.util.List;

public final class LimitLower implements MarkupNode {
    public final MarkupNode base;
    public final MarkupNode limit;

    public LimitLower(MarkupNode base, MarkupNode limit) {
        this.base = base;
        this.limit = limit;
    }

    @Override
    public String kind() {
        return "lower limit";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(base, limit);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("base", base, "limit", limit);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitLimitLower(this, arg);
    }
}
