package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.layout.DelimiterScaler;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out {@code \binom{n}{k}}: a rule-less fraction between stretched parentheses.
 *
 * @since 1.0
 */
public final class BinomialMeasurer implements NodeMeasurer<BinomialNode> {

  @Override
  public NodeLayout measure(BinomialNode node, RenderContext context, MeasureScope scope) {
    final RenderContext childStyle = context.shrink(MathConstants.BINOMIAL_CHILD_SCALE);
    final NodeLayout top = scope.measureGroup(List.of(node.top()), childStyle);
    final NodeLayout bottom = scope.measureGroup(List.of(node.bottom()), childStyle);

    final float fontSize = context.getFontSizePx();
    final float gap = fontSize * MathConstants.BINOMIAL_GAP;
    final float padding = fontSize * MathConstants.DELIMITER_PADDING;
    final float contentWidth = Math.max(top.width(), bottom.width());
    final float contentHeight = top.height() + gap + bottom.height();
    final float height = contentHeight + padding * 2f;
    final float baseline = top.height() + gap / 2f + padding + scope.axisHeight(context);

    final NodeLayout left = DelimiterScaler.measureScaled("(", context, scope.shaper(), height);
    final NodeLayout right = DelimiterScaler.measureScaled(")", context, scope.shaper(), height);
    final float width = left.width() + contentWidth + right.width();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      final float contentX = x + left.width();
      final float contentY = y + padding;
      left.draw(canvas, x, y);
      top.draw(canvas, contentX + (contentWidth - top.width()) / 2f, contentY);
      bottom.draw(canvas, contentX + (contentWidth - bottom.width()) / 2f, contentY + top.height() + gap);
      right.draw(canvas, contentX + contentWidth, y);
    });
  }
}
