package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Element the reader does not recognize. Its children are kept and converted in order,
 * so unrecognized markup never loses content.
 */
public final class Unknown implements MarkupNode {
    public final String tag;
    public final List<MarkupNode> children;

    public Unknown(String tag, List<? extends MarkupNode> children) {
        this.tag = tag;
        this.children = NodeLists.copy(children);
    }

    public static Unknown of(String tag, MarkupNode... children) {
        return new Unknown(tag, NodeLists.of(children));
    }

    @Override
    public String kind() {
        return "unknown";
    }

    @Override
    public List<MarkupNode> slots() {
        return children;
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitUnknown(this, arg);
    }
}
