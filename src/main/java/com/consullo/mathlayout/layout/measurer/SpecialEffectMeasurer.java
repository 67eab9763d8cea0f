package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.Painter;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.BoxedNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.PhantomNode;
import com.consullo.mathlayout.core.tree.SmashNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * {@code \boxed}, the {@code \phantom} family and {@code \smash}.
 *
 * @since 1.0
 */
public final class SpecialEffectMeasurer implements NodeMeasurer<MathNode> {

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    if (node instanceof BoxedNode) {
      return measureBoxed((BoxedNode) node, context, scope);
    }
    if (node instanceof PhantomNode) {
      return measurePhantom((PhantomNode) node, context, scope);
    }
    if (node instanceof SmashNode) {
      return measureSmash((SmashNode) node, context, scope);
    }
    throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
  }

  private NodeLayout measureBoxed(BoxedNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(node.content(), context);
    final float padding = context.getFontSizePx() * MathConstants.BOXED_PADDING;
    final float border = context.dp(MathConstants.BOXED_BORDER_DP);
    final float width = content.width() + padding * 2f;
    final float height = content.height() + padding * 2f;
    final int color = context.getColor();

    return new NodeLayout(width, height, content.baseline() + padding, (canvas, x, y) -> {
      content.draw(canvas, x + padding, y + padding);
      canvas.drawRect(x, y, width, height, border, color);
    });
  }

  private NodeLayout measurePhantom(PhantomNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(node.content(), context);
    switch (node.kind()) {
      case HPHANTOM:
        return NodeLayout.blank(content.width(), 0f, 0f);
      case VPHANTOM:
        return NodeLayout.blank(0f, content.height(), content.baseline());
      default:
        return new NodeLayout(content.width(), content.height(), content.baseline(), Painter.NONE);
    }
  }

  /** Content drawn in place but contributing no height, so its ink may overflow the line. */
  private NodeLayout measureSmash(SmashNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(node.content(), context);
    return new NodeLayout(content.width(), 0f, 0f,
        (canvas, x, y) -> content.draw(canvas, x, y - content.baseline()));
  }
}
