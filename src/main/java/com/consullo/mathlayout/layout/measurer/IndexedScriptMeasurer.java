package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SideSetNode;
import com.consullo.mathlayout.core.tree.TensorNode;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * Scripts that are not a simple base-plus-script pair: {@code \sideset} and tensors with
 * staggered indices. Shifts match ordinary super- and subscripts.
 *
 * @since 1.0
 */
public final class IndexedScriptMeasurer implements NodeMeasurer<MathNode> {

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    if (node instanceof SideSetNode) {
      return measureSideSet((SideSetNode) node, context, scope);
    }
    if (node instanceof TensorNode) {
      return measureTensor((TensorNode) node, context, scope);
    }
    throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
  }

  private NodeLayout measureSideSet(SideSetNode node, RenderContext context, MeasureScope scope) {
    final RenderContext scriptStyle = context.toScriptStyle();
    final NodeLayout base = scope.measure(node.base(), context);
    final NodeLayout leftSub = measureOptional(node.leftSub(), scriptStyle, scope);
    final NodeLayout leftSup = measureOptional(node.leftSup(), scriptStyle, scope);
    final NodeLayout rightSub = measureOptional(node.rightSub(), scriptStyle, scope);
    final NodeLayout rightSup = measureOptional(node.rightSup(), scriptStyle, scope);

    final float kern = ScriptShifts.kern(context);
    final float supY = ScriptShifts.relativeY(true, context);
    final float subY = ScriptShifts.relativeY(false, context);

    final float leftColumn = Math.max(width(leftSub), width(leftSup));
    final float baseX = leftColumn > 0f ? leftColumn + kern : 0f;
    final float rightX = baseX + base.width() + kern;
    final float rightColumn = Math.max(width(rightSub), width(rightSup));

    final BaselineRow row = new BaselineRow().add(base, baseX, 0f);
    if (leftSup != null) {
      row.add(leftSup, leftColumn - leftSup.width(), supY);
    }
    if (leftSub != null) {
      row.add(leftSub, leftColumn - leftSub.width(), subY);
    }
    if (rightSup != null) {
      row.add(rightSup, rightX, supY);
    }
    if (rightSub != null) {
      row.add(rightSub, rightX, subY);
    }
    return row.build(rightColumn > 0f ? rightX + rightColumn : baseX + base.width());
  }

  /** Each index gets its own column, so raised and lowered indices never share an x range. */
  private NodeLayout measureTensor(TensorNode node, RenderContext context, MeasureScope scope) {
    final RenderContext scriptStyle = context.toScriptStyle();
    final NodeLayout base = scope.measure(node.base(), context);
    final BaselineRow row = new BaselineRow().add(base, 0f, 0f);

    float x = base.width();
    if (!node.indices().isEmpty()) {
      x += ScriptShifts.kern(context);
    }
    for (TensorNode.Index index : node.indices()) {
      final NodeLayout script = scope.measure(index.script(), scriptStyle);
      row.add(script, x, ScriptShifts.relativeY(index.upper(), context));
      x += script.width();
    }
    return row.build(x);
  }

  private static NodeLayout measureOptional(MathNode node, RenderContext style, MeasureScope scope) {
    return node == null ? null : scope.measure(node, style);
  }

  private static float width(NodeLayout layout) {
    return layout == null ? 0f : layout.width();
  }
}
