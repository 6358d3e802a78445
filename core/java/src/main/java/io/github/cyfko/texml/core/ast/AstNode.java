package io.github.cyfko.texml.core.ast;

/**
 * Node of the abstract syntax tree built by the parser and consumed by the MathML generator.
 * <p>
 * The hierarchy is closed: every LaTeX construct maps to exactly one record implementing
 * this interface. Nodes are immutable and own their children exclusively, so a tree never
 * shares a node between two parents.
 * </p>
 *
 * <pre>{@code
 * AstNode ast = compiler.parseToAst("x_i^2");
 * if (ast instanceof SubSupNode scripts) {
 *     // scripts.base(), scripts.subscript(), scripts.superscript()
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface AstNode permits
        NumberNode, IdentifierNode, SymbolNode, OperatorNode, TextNode, SpaceNode,
        SqrtNode, RootNode, AccentNode, StyleNode, MathStyleNode, MathSizeNode, ColorNode, PhantomNode,
        FractionNode, BinomialNode, AtopNode,
        SubscriptNode, SuperscriptNode, SubSupNode,
        RowNode, DelimitedNode, SizedDelimiterNode, MatrixNode,
        FunctionNode, BigOperatorNode, UnderOverNode,
        SINumberNode, SIUnitNode, SIValueNode {

    /**
     * Double dispatch entry point.
     *
     * @param visitor the visitor
     * @param <R>     visitor result type
     * @return the visitor's result for this node
     */
    <R> R accept(AstVisitor<R> visitor);
}
