package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.HSpaceNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.NewLineNode;
import com.consullo.mathlayout.core.tree.OperatorNode;
import com.consullo.mathlayout.core.tree.SimpleMathNodeVisitor;
import com.consullo.mathlayout.core.tree.SpaceNode;
import com.consullo.mathlayout.core.tree.SymbolNode;
import com.consullo.mathlayout.core.tree.TextModeNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.GlyphLayouts;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * Measures leaf nodes: text, symbols, named operators and spaces.
 *
 * <p>
 * Math text uses the context font as-is. {@code \text{...}} and named operators switch to the
 * upright roman face. Spaces are invisible boxes of a fixed em width. A line break measures as an
 * empty box; the group orchestrator is what actually breaks the line.
 * </p>
 *
 * @since 1.0
 */
public final class TextContentMeasurer implements NodeMeasurer<MathNode> {

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    return node.accept(new LeafVisitor(scope), context);
  }

  private static RenderContext upright(RenderContext context) {
    return context.toBuilder().fontFamily(FontFamily.ROMAN).italic(false).build();
  }

  private static final class LeafVisitor extends SimpleMathNodeVisitor<NodeLayout, RenderContext> {

    private final MeasureScope scope;

    private LeafVisitor(MeasureScope scope) {
      this.scope = scope;
    }

    @Override
    protected NodeLayout defaultAction(MathNode node, RenderContext context) {
      throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    @Override
    public NodeLayout visitText(TextNode node, RenderContext context) {
      return GlyphLayouts.shape(node.content(), context, scope.shaper());
    }

    @Override
    public NodeLayout visitTextMode(TextModeNode node, RenderContext context) {
      return GlyphLayouts.shape(node.text(), upright(context), scope.shaper());
    }

    @Override
    public NodeLayout visitSymbol(SymbolNode node, RenderContext context) {
      return GlyphLayouts.shape(node.displayText(), context, scope.shaper());
    }

    @Override
    public NodeLayout visitOperator(OperatorNode node, RenderContext context) {
      return GlyphLayouts.shape(node.name(), upright(context), scope.shaper());
    }

    @Override
    public NodeLayout visitSpace(SpaceNode node, RenderContext context) {
      return NodeLayout.blank(context.getFontSizePx() * node.kind().em(), 0f, 0f);
    }

    @Override
    public NodeLayout visitHSpace(HSpaceNode node, RenderContext context) {
      return NodeLayout.blank(Math.max(0f, context.getFontSizePx() * node.widthEm()), 0f, 0f);
    }

    @Override
    public NodeLayout visitNewLine(NewLineNode node, RenderContext context) {
      return NodeLayout.empty();
    }
  }
}
