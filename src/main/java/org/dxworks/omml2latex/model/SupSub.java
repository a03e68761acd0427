package org.dxworks.omml2latex.model;

import java.util.List;

/**
 * Base with a subscript, a superscript, or both. The form is fixed by the source element,
 * so a superscript element that lost its exponent still renders as a superscript.
 */
public final class SupSub implements MarkupNode {

    public enum Form {
        SUPERSCRIPT,
        SUBSCRIPT,
        BOTH
    }

    public final Form form;
    public final MarkupNode base;
    public final MarkupNode sub;
    public final MarkupNode sup;

    public SupSub(Form form, MarkupNode base, MarkupNode sub, MarkupNode sup) {
        this.form = form == null ? inferForm(sub, sup) : form;
        this.base = base;
        this.sub = sub;
        this.sup = sup;
    }

    public SupSub(MarkupNode base, MarkupNode sub, MarkupNode sup) {
        this(null, base, sub, sup);
    }

    public static SupSub superscript(MarkupNode base, MarkupNode sup) {
        return new SupSub(Form.SUPERSCRIPT, base, null, sup);
    }

    public static SupSub subscript(MarkupNode base, MarkupNode sub) {
        return new SupSub(Form.SUBSCRIPT, base, sub, null);
    }

    private static Form inferForm(MarkupNode sub, MarkupNode sup) {
        if (sub != null && sup != null) {
            return Form.BOTH;
        }
        return sub != null ? Form.SUBSCRIPT : Form.SUPERSCRIPT;
    }

    @Override
    public String kind() {
        return switch (form) {
            case SUBSCRIPT -> "subscript";
            case BOTH -> "sub-superscript";
            case SUPERSCRIPT -> "superscript";
        };
    }

    @Override
    public List<MarkupNode> slots() {
        return NodeLists.of(base, sub, sup);
    }

    @Override
    public List<String> missingParts() {
        return switch (form) {
            case SUBSCRIPT -> NodeLists.missing("base", base, "subscript", sub);
            case BOTH -> NodeLists.missing("base", base, "subscript", sub, "superscript", sup);
            case SUPERSCRIPT -> NodeLists.missing("base", base, "superscript", sup);
        };
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitSupSub(this, arg);
    }
}
