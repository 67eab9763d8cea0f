package com.consullo.mathlayout.core.tree;

/**
 * Visitor over every {@link MathNode} kind.
 *
 * @param <R> result type
 * @param <P> parameter type
 * @since 1.0
 */
public interface MathNodeVisitor<R, P> {

  R visitText(TextNode node, P param);

  R visitTextMode(TextModeNode node, P param);

  R visitSymbol(SymbolNode node, P param);

  R visitOperator(OperatorNode node, P param);

  R visitSpace(SpaceNode node, P param);

  R visitHSpace(HSpaceNode node, P param);

  R visitNewLine(NewLineNode node, P param);

  R visitGroup(GroupNode node, P param);

  R visitDocument(DocumentNode node, P param);

  R visitStyle(StyleNode node, P param);

  R visitColor(ColorNode node, P param);

  R visitMathStyle(MathStyleNode node, P param);

  R visitFraction(FractionNode node, P param);

  R visitRoot(RootNode node, P param);

  R visitSuperscript(SuperscriptNode node, P param);

  R visitSubscript(SubscriptNode node, P param);

  R visitBigOperator(BigOperatorNode node, P param);

  R visitAccent(AccentNode node, P param);

  R visitBinomial(BinomialNode node, P param);

  R visitDelimited(DelimitedNode node, P param);

  R visitSizedDelimiter(SizedDelimiterNode node, P param);

  R visitStack(StackNode node, P param);

  R visitExtensibleArrow(ExtensibleArrowNode node, P param);

  R visitBoxed(BoxedNode node, P param);

  R visitPhantom(PhantomNode node, P param);

  R visitSmash(SmashNode node, P param);

  R visitSideSet(SideSetNode node, P param);

  R visitTensor(TensorNode node, P param);

  R visitMatrix(MatrixNode node, P param);

  R visitCases(CasesNode node, P param);

  R visitAligned(AlignedNode node, P param);

  R visitMultline(MultlineNode node, P param);
}
