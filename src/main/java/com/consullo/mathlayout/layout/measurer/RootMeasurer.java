package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out {@code \sqrt[index]{content}} with a stroked radical sign and a bar over the content.
 *
 * <p>
 * The index is shrunk and tucked into the upper left so it sits on the hook. The box includes half
 * the stroke width on the top and right edges.
 * </p>
 *
 * @since 1.0
 */
public final class RootMeasurer implements NodeMeasurer<RootNode> {

  @Override
  public NodeLayout measure(RootNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(List.of(node.content()), context);
    final NodeLayout index = node.index() == null
        ? null
        : scope.measureGroup(List.of(node.index()), context.shrink(MathConstants.RADICAL_INDEX_SCALE));

    final float fontSize = context.getFontSizePx();
    final float rule = fontSize * MathConstants.RADICAL_RULE_THICKNESS;
    final float strokeHalf = rule / 2f;
    final float extraTop = rule * MathConstants.RADICAL_TOP_GAP_MULTIPLIER + rule;
    final float hookWidth = fontSize * MathConstants.RADICAL_HOOK_WIDTH;

    final float indexWidth = index == null ? 0f : index.width();
    final float contentX = Math.max(hookWidth, indexWidth) + rule;
    final float height = content.height() + extraTop + strokeHalf;
    final float baseline = content.baseline() + extraTop;
    final float width = contentX + content.width() + rule + strokeHalf;

    final float topY = rule / 2f;
    final float midY = height * 0.5f;
    final VectorPath sign = VectorPath.builder()
        .moveTo(contentX, topY)
        .lineTo(contentX - hookWidth * 0.4f, height - rule - strokeHalf)
        .lineTo(contentX - hookWidth * 0.8f, midY + rule)
        .lineTo(contentX - hookWidth, midY + rule * 2f)
        .build();
    final int color = context.getColor();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      if (index != null) {
        index.draw(canvas, x, y + midY - index.height());
      }
      content.draw(canvas, x + contentX, y + extraTop);
      canvas.drawLine(x + contentX, y + topY, x + width - strokeHalf, y + topY, rule, color);
      canvas.drawPath(sign, x, y, rule, color);
    });
  }
}
