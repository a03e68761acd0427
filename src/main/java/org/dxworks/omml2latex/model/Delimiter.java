package org.dxworks.omml2latex.model;

import java.util.List;
import java.util.Objects;

/**
 * Scalable brackets around one or more items. An empty open or close character means an
 * invisible delimiter on that side.
 */
public final class Delimiter implements MarkupNode {
    public static final String DEFAULT_OPEN = "(";
    public static final String DEFAULT_CLOSE = ")";
    public static final String DEFAULT_SEPARATOR = "|";

    public final String openChar;
    public final String closeChar;
    public final String separatorChar;
    public final List<MarkupNode> items;

    public Delimiter(String openChar, String closeChar, String separatorChar, List<? extends MarkupNode> items) {
        this.openChar = Objects.requireNonNullElse(openChar, DEFAULT_OPEN);
        this.closeChar = Objects.requireNonNullElse(closeChar, DEFAULT_CLOSE);
        this.separatorChar = Objects.requireNonNullElse(separatorChar, DEFAULT_SEPARATOR);
        this.items = NodeLists.copy(items);
    }

    public Delimiter(String openChar, String closeChar, MarkupNode body) {
        this(openChar, closeChar, null, NodeLists.of(body));
    }

    @Override
    public String kind() {
        return "delimiter";
    }

    @Override
    public List<MarkupNode> slots() {
        return items;
    }

    @Override
    public List<String> missingParts() {
        if (items.isEmpty() || items.stream().allMatch(Objects::isNull)) {
            return List.of("body");
        }
        return List.of();
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitDelimiter(this, arg);
    }
}
