package org.dxworks.omml2latex.model;

import java.util.List;

public final class EquationArray implements MarkupNode {
    public final List<MarkupNode> items;

    public EquationArray(List<? extends MarkupNode> items) {
        this.items = NodeLists.copy(items);
    }

    @Override
    public String kind() {
        return "equation array";
    }

    @Override
    public List<MarkupNode> slots() {
        return items;
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitEquationArray(this, arg);
    }
}
