package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * Layout algorithm for one family of node kinds.
 *
 * <p>
 * Implementations are stateless. They measure children through the {@link MeasureScope},
 * combine the resulting boxes and return a new box whose painter positions the children.
 * </p>
 *
 * @param <T> node kind handled
 * @since 1.0
 */
public interface NodeMeasurer<T extends MathNode> {

  /**
   * Measure {@code node}.
   *
   * @param node node to measure
   * @param context style in effect
   * @param scope callbacks into the engine
   * @return new layout
   */
  NodeLayout measure(T node, RenderContext context, MeasureScope scope);
}
