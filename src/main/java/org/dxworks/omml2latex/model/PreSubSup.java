package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Scripts placed before the base, as in tensor or isotope notation.
 */
public final class PreSubSup implements MarkupNode {
    public final MarkupNode sub;
    public final MarkupNode sup;
    public final MarkupNode base;

    public PreSubSup(MarkupNode sub, MarkupNode sup, MarkupNode base) {
        this.sub = sub;
        this.sup = sup;
        this.base = base;
    }

    @Override
    public String kind() {
        return "pre-script";
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(sub, sup, base);
    }

    @Override
    public List<String> missingParts() {
        return NodeLists.missing("base", base);
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitPreSubSup(this, arg);
    }
}
