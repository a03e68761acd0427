package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Grouping character stretched over or under the base, typically a brace.
 */
public final class GroupChar implements MarkupNode {
    public static final String DEFAULT_CHAR = "⏟";

    public final String groupChar;
    public final MarkupNode base;

    public GroupChar(String groupChar, MarkupNode base) {
        this.groupChar = groupChar == null ? DEFAULT_CHAR : groupChar;
        this.base = base;
    }

    @Override
    public String kind() {
        return "group character";
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
        return visitor.visitGroupChar(this, arg);
    }
}
