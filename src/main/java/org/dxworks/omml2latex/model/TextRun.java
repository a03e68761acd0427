package org.dxworks.omml2latex.model;

import java.util.List;
import java.util.Objects;

/**
 * Literal characters of a math run. Each character is resolved against the symbol table on conversion.
 */
public final class TextRun implements MarkupNode {
    public final String text;

    public TextRun(String text) {
        this.text = Objects.requireNonNullElse(text, "");
    }

    @Override
    public String kind() {
        return "text";
    }

    @Override
    public List<MarkupNode> slots() {
        return List.of();
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitTextRun(this, arg);
    }
}
