package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Recognized container whose items are converted and concatenated, such as an argument
 * ({@code m:e}), a numerator or a whole {@code m:oMath}.
 */
public final class Sequence implements MarkupNode {
    public final List<MarkupNode> items;

    public Sequence(List<? extends MarkupNode> items) {
        this.items = NodeLists.copy(items);
    }

    public static Sequence of(MarkupNode... items) {
        return new Sequence(NodeLists.of(items));
    }

    @Override
    public String kind() {
        return "sequence";
    }

    @Override
    public List<MarkupNode> slots() {
        return items;
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitSequence(this, arg);
    }
}
