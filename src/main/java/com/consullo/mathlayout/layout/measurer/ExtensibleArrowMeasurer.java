package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.Canvas;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.ExtensibleArrowNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out {@code \xrightarrow[below]{above}} and its left and two-headed variants.
 *
 * <p>
 * The arrow is at least 30dp long and otherwise as long as the wider label, plus padding at both
 * ends. The baseline runs through the middle of the shaft.
 * </p>
 *
 * @since 1.0
 */
public final class ExtensibleArrowMeasurer implements NodeMeasurer<ExtensibleArrowNode> {

  @Override
  public NodeLayout measure(ExtensibleArrowNode node, RenderContext context, MeasureScope scope) {
    final RenderContext labelStyle = context.shrink(MathConstants.EXTENSIBLE_ARROW_LABEL_SCALE);
    final NodeLayout above = scope.measureGroup(List.of(node.content()), labelStyle);
    final NodeLayout below = node.below() == null ? null : scope.measureGroup(List.of(node.below()), labelStyle);

    final float padding = context.dp(MathConstants.EXTENSIBLE_ARROW_PADDING_DP);
    final float strokeHeight = context.dp(MathConstants.EXTENSIBLE_ARROW_STROKE_HEIGHT_DP);
    final float textGap = context.dp(MathConstants.EXTENSIBLE_ARROW_TEXT_GAP_DP);
    final float labelWidth = Math.max(above.width(), below == null ? 0f : below.width());
    final float width = Math.max(labelWidth, context.dp(MathConstants.EXTENSIBLE_ARROW_MIN_LENGTH_DP)) + padding * 2f;

    final float arrowY = above.height() + textGap;
    final float belowY = arrowY + strokeHeight + textGap;
    final float height = below == null ? arrowY + strokeHeight : belowY + below.height();
    final float baseline = arrowY + strokeHeight / 2f;
    final float stroke = context.dp(MathConstants.EXTENSIBLE_ARROW_STROKE_DP);
    final float head = context.dp(MathConstants.EXTENSIBLE_ARROW_HEAD_DP);
    final ExtensibleArrowNode.Direction direction = node.direction();
    final int color = context.getColor();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      above.draw(canvas, x + (width - above.width()) / 2f, y);
      drawArrow(canvas, direction, x + padding, x + width - padding, y + baseline, stroke, head, color);
      if (below != null) {
        below.draw(canvas, x + (width - below.width()) / 2f, y + belowY);
      }
    });
  }

  private static void drawArrow(
      Canvas canvas, ExtensibleArrowNode.Direction direction, float startX, float endX, float centerY,
      float stroke, float head, int color) {
    canvas.drawLine(startX, centerY, endX, centerY, stroke, color);
    if (direction != ExtensibleArrowNode.Direction.LEFT) {
      canvas.drawPath(head(endX, centerY, -head), 0f, 0f, 0f, color);
    }
    if (direction != ExtensibleArrowNode.Direction.RIGHT) {
      canvas.drawPath(head(startX, centerY, head), 0f, 0f, 0f, color);
    }
  }

  /** Filled triangle with its tip at {@code (tipX, centerY)}; {@code length} is signed. */
  private static VectorPath head(float tipX, float centerY, float length) {
    final float half = Math.abs(length) / 2f;
    return VectorPath.builder()
        .moveTo(tipX, centerY)
        .lineTo(tipX + length, centerY - half)
        .lineTo(tipX + length, centerY + half)
        .close()
        .build();
  }
}
