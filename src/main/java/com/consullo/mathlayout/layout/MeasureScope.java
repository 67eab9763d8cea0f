package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.Shaper;
import com.consullo.mathlayout.core.tree.MathNode;
import java.util.List;

/**
 * Services a measurer may call back into while measuring a node.
 *
 * @since 1.0
 */
public interface MeasureScope {

  Shaper shaper();

  /**
   * Measure any node with the given style.
   *
   * @param node node
   * @param context style
   * @return layout
   */
  NodeLayout measure(MathNode node, RenderContext context);

  /**
   * Measure a sibling sequence with baseline alignment and atom spacing.
   *
   * @param nodes siblings
   * @param context style
   * @return layout of the whole sequence
   */
  NodeLayout measureGroup(List<MathNode> nodes, RenderContext context);

  /**
   * Math axis height for the given style.
   *
   * @param context style
   * @return axis height above the baseline
   */
  float axisHeight(RenderContext context);
}
