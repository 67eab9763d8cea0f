package com.consullo.mathlayout.core.tree;

/**
 * Visitor that routes every kind to {@link #defaultAction(MathNode, Object)} unless overridden.
 *
 * <p>Useful when only a handful of kinds are interesting, e.g. the compound constructs an editor
 * can step into.</p>
 *
 * @param <R> result type
 * @param <P> parameter type
 * @since 1.0
 */
public abstract class SimpleMathNodeVisitor<R, P> implements MathNodeVisitor<R, P> {

  protected abstract R defaultAction(MathNode node, P param);

  @Override
  public R visitText(TextNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitTextMode(TextModeNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSymbol(SymbolNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitOperator(OperatorNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSpace(SpaceNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitHSpace(HSpaceNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitNewLine(NewLineNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitGroup(GroupNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitDocument(DocumentNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitStyle(StyleNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitColor(ColorNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitMathStyle(MathStyleNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitFraction(FractionNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitRoot(RootNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSuperscript(SuperscriptNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSubscript(SubscriptNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitBigOperator(BigOperatorNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitAccent(AccentNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitBinomial(BinomialNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitDelimited(DelimitedNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSizedDelimiter(SizedDelimiterNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitStack(StackNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitExtensibleArrow(ExtensibleArrowNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitBoxed(BoxedNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitPhantom(PhantomNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSmash(SmashNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitSideSet(SideSetNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitTensor(TensorNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitMatrix(MatrixNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitCases(CasesNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitAligned(AlignedNode node, P param) {
    return defaultAction(node, param);
  }

  @Override
  public R visitMultline(MultlineNode node, P param) {
    return defaultAction(node, param);
  }
}
