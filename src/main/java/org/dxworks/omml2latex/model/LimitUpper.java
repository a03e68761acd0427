package org.dxworks.omml2latex.model;

import java.util.List;

public final class LimitUpper implements MarkupNode {
    public final MarkupNode base;
    public final MarkupNode limit;

    public LimitUpper(MarkupNode base, MarkupNode limit) {
        this.base = base;
        this.limit = limit;
    }

    @Override
    public String kind() {
        return "upper limit";
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
        return visitor.visitLimitUpper(this, arg);
    }
}
