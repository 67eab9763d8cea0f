package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.StackNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out {@code \overset}, <code>&#92;underset</code> and {@code \stackrel}: small content centred above
 * and/or below a base, with the baseline staying on the base.
 *
 * @since 1.0
 */
public final class StackMeasurer implements NodeMeasurer<StackNode> {

  @Override
  public NodeLayout measure(StackNode node, RenderContext context, MeasureScope scope) {
    final RenderContext scriptStyle = context.shrink(MathConstants.STACK_SCRIPT_SCALE);
    final NodeLayout base = scope.measureGroup(List.of(node.base()), context);
    final NodeLayout above = node.above() == null ? null : scope.measureGroup(List.of(node.above()), scriptStyle);
    final NodeLayout below = node.below() == null ? null : scope.measureGroup(List.of(node.below()), scriptStyle);

    final float gap = context.getFontSizePx() * MathConstants.STACK_GAP;
    final float baseY = above == null ? 0f : above.height() + gap;
    final float belowY = baseY + base.height() + gap;
    final float height = below == null ? baseY + base.height() : belowY + below.height();
    final float width = Math.max(base.width(), Math.max(
        above == null ? 0f : above.width(),
        below == null ? 0f : below.width()));

    return new NodeLayout(width, height, baseY + base.baseline(), (canvas, x, y) -> {
      if (above != null) {
        above.draw(canvas, x + (width - above.width()) / 2f, y);
      }
      base.draw(canvas, x + (width - base.width()) / 2f, y + baseY);
      if (below != null) {
        below.draw(canvas, x + (width - below.width()) / 2f, y + belowY);
      }
    });
  }
}
