package org.dxworks.omml2latex.model;

/**
 * Visitor over every {@link MarkupNode} variant. Adding a variant adds a method here,
 * so every implementation has to decide how to handle it.
 *
 * @param <R> result type
 * @param <A> argument passed along with each node
 */
public interface MarkupVisitor<R, A> {
    R visitTextRun(TextRun node, A arg);

    R visitSequence(Sequence node, A arg);

    R visitFraction(Fraction node, A arg);

    R visitSupSub(SupSub node, A arg);

    R visitRadical(Radical node, A arg);

    R visitNaryOperator(NaryOperator node, A arg);

    R visitDelimiter(Delimiter node, A arg);

    R visitFunction(Function node, A arg);

    R visitMatrix(Matrix node, A arg);

    R visitAccent(Accent node, A arg);

    R visitEquationArray(EquationArray node, A arg);

    R visitBar(Bar node, A arg);

    R visitGroupChar(GroupChar node, A arg);

    R visitLimitLower(LimitLower node, A arg);

    R visitLimitUpper(LimitUpper node, A arg);

    R visitPreSubSup(PreSubSup node, A arg);

    R visitUnknown(Unknown node, A arg);
}
