package org.dxworks.omml2latex.model;

import java.util.List;

public final class Radical implements MarkupNode {
    public final MarkupNode degree;
    public final MarkupNode radicand;
    public final boolean degreeHidden;

    public Radical(MarkupNode degree, MarkupNode radicand, boolean degreeHidden) {
        this.degree = degree;
        this.radicand = radicand;
        this.degreeHidden = degreeHidden;
    }

    public static Radical squareRoot(MarkupNode radicand) {
        return new Radical(null, radicand, true);
    }

    @Override
    public String kind() {
        return "radical";
    }

    @Override
    public List<MarkupNode> slots() {
        // a hidden degree is never converted
        return degreeHidden ? NodeLists.of(null, radicand) : NodeLists.of(degree, radicand);
    }

    @Override
    public List<String> missingParts() {
        if (degreeHidden) {
            return NodeLists.missing("radicand", radicand);
        }
        return NodeLists.missing("degree", degree, "radicand", radicand);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitRadical(this, arg);
    }
}
