package io.github.cyfko.texml.core.ast;

/**
 * Visitor over the closed {@link AstNode} hierarchy.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface AstVisitor<R> {
    R visitNumber(NumberNode node);

    R visitIdentifier(IdentifierNode node);

    R visitSymbol(SymbolNode node);

    R visitOperator(OperatorNode node);

    R visitText(TextNode node);

    R visitSpace(SpaceNode node);

    R visitSqrt(SqrtNode node);

    R visitRoot(RootNode node);

    R visitAccent(AccentNode node);

    R visitStyle(StyleNode node);

    R visitMathStyle(MathStyleNode node);

    R visitMathSize(MathSizeNode node);

    R visitColor(ColorNode node);

    R visitPhantom(PhantomNode node);

    R visitFraction(FractionNode node);

    R visitBinomial(BinomialNode node);

    R visitAtop(AtopNode node);

    R visitSubscript(SubscriptNode node);

    R visitSuperscript(SuperscriptNode node);

    R visitSubSup(SubSupNode node);

    R visitRow(RowNode node);

    R visitDelimited(DelimitedNode node);

    R visitSizedDelimiter(SizedDelimiterNode node);

    R visitMatrix(MatrixNode node);

    R visitFunction(FunctionNode node);

    R visitBigOperator(BigOperatorNode node);

    R visitUnderOver(UnderOverNode node);

    R visitSINumber(SINumberNode node);

    R visitSIUnit(SIUnitNode node);

    R visitSIValue(SIValueNode node);
}
