package org.dxworks.omml2latex.model;

import java.util.List;

public final class Fraction implements MarkupNode {
    public final MarkupNode numerator;
    public final MarkupNode denominator;

    public Fraction(MarkupNode numerator, MarkupNode denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    @Override
    public String kind() {
        return "fraction";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(numerator, denominator);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("numerator", numerator, "denominator", denominator);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitFraction(this, arg);
    }
}
