package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Summation, product, integral and similar big operators with optional bounds.
 */
public final class NaryOperator implements MarkupNode {
    /** Operator glyph, or null when the markup left it at its default (integral). */
    public final String operatorChar;
    public final MarkupNode lowerBound;
    public final MarkupNode upperBound;
    public final MarkupNode body;

    public NaryOperator(String operatorChar, MarkupNode lowerBound, MarkupNode upperBound, MarkupNode body) {
        this.operatorChar = operatorChar;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.body = body;
    }

    @Override
    public String kind() {
        return "n-ary operator";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(lowerBound, upperBound, body);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("body", body);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitNaryOperator(this, arg);
    }
}
