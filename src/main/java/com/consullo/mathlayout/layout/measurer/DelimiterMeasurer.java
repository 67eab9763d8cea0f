package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.DelimitedNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SizedDelimiterNode;
import com.consullo.mathlayout.layout.DelimiterScaler;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * Lays out {@code \left( ... \right)} and the manually sized {@code \big}/{@code \Big}/... family.
 *
 * @since 1.0
 */
public final class DelimiterMeasurer implements NodeMeasurer<MathNode> {

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    if (node instanceof DelimitedNode) {
      return measureDelimited((DelimitedNode) node, context, scope);
    }
    if (node instanceof SizedDelimiterNode) {
      return measureSized((SizedDelimiterNode) node, context, scope);
    }
    throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
  }

  /**
   * Delimiters are stretched to the content height plus padding above and below. A {@code .}
   * delimiter takes no space.
   */
  private NodeLayout measureDelimited(DelimitedNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(node.content(), context);
    final float padding = context.getFontSizePx() * MathConstants.DELIMITER_PADDING;
    final float height = content.height() + padding * 2f;

    final NodeLayout left = DelimitedNode.NONE.equals(node.left())
        ? null
        : DelimiterScaler.measureScaled(node.left(), context, scope.shaper(), height);
    final NodeLayout right = DelimitedNode.NONE.equals(node.right())
        ? null
        : DelimiterScaler.measureScaled(node.right(), context, scope.shaper(), height);

    final float leftWidth = left == null ? 0f : left.width();
    final float rightWidth = right == null ? 0f : right.width();
    final float width = leftWidth + content.width() + rightWidth;

    return new NodeLayout(width, height, content.baseline() + padding, (canvas, x, y) -> {
      if (left != null) {
        left.draw(canvas, x, y);
      }
      content.draw(canvas, x + leftWidth, y + padding);
      if (right != null) {
        right.draw(canvas, x + leftWidth + content.width(), y);
      }
    });
  }

  /**
   * Without dedicated size fonts the glyph is simply drawn at {@code scale} times the font size,
   * centred on the math axis.
   */
  private NodeLayout measureSized(SizedDelimiterNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout glyph = DelimiterScaler.measure(node.delimiter(), context.grow(node.scale()), scope.shaper());
    final float baseline = glyph.height() / 2f + scope.axisHeight(context);
    return new NodeLayout(glyph.width(), glyph.height(), baseline, glyph.painter());
  }
}
