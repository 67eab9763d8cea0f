package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out {@code \frac}: numerator over a rule over denominator, both centred.
 *
 * <pre>
 *   numerator
 *      gap
 *   ---------   rule; baseline = ruleY + thickness/2 + axis
 *      gap
 *  denominator
 * </pre>
 *
 * @since 1.0
 */
public final class FractionMeasurer implements NodeMeasurer<FractionNode> {

  @Override
  public NodeLayout measure(FractionNode node, RenderContext context, MeasureScope scope) {
    final RenderContext childStyle = context.toFractionChildStyle();
    final NodeLayout numerator = scope.measureGroup(List.of(node.numerator()), childStyle);
    final NodeLayout denominator = scope.measureGroup(List.of(node.denominator()), childStyle);

    final float fontSize = context.getFontSizePx();
    final float ruleThickness = fontSize * MathConstants.FRACTION_RULE_THICKNESS;
    final float gap = fontSize * MathConstants.FRACTION_GAP;
    final float inset = fontSize * MathConstants.FRACTION_RULE_INSET;
    final float axisHeight = scope.axisHeight(context);

    final float width = Math.max(numerator.width(), denominator.width()) + gap;
    final float ruleY = numerator.height() + gap;
    final float denominatorTop = ruleY + ruleThickness + gap;
    final float height = denominatorTop + denominator.height();
    final float baseline = ruleY + ruleThickness / 2f + axisHeight;
    final int color = context.getColor();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      numerator.draw(canvas, x + (width - numerator.width()) / 2f, y);
      final float lineY = y + ruleY + ruleThickness / 2f;
      canvas.drawLine(x + inset, lineY, x + width - inset, lineY, ruleThickness, color);
      denominator.draw(canvas, x + (width - denominator.width()) / 2f, y + denominatorTop);
    });
  }
}
