package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Node of a parsed math expression tree.
 *
 * <p>
 * The set of node kinds is closed: every kind has a matching method on {@link MathNodeVisitor},
 * so a visitor implementation is forced to handle all of them. Nodes are immutable records. The
 * source range is optional; nodes synthesized by the parser without a source position return
 * null and drop out of offset-based lookups.
 * </p>
 *
 * @since 1.0
 */
public interface MathNode {

  /**
   * Source span this node was parsed from.
   *
   * @return range, or null when unknown
   */
  SourceRange sourceRange();

  /**
   * Direct children in document order. Absent optional children are omitted.
   *
   * @return child nodes, never null
   */
  List<MathNode> children();

  /**
   * Double-dispatch entry point.
   *
   * @param visitor visitor
   * @param param visitor parameter
   * @param <R> result type
   * @param <P> parameter type
   * @return visitor result
   */
  <R, P> R accept(MathNodeVisitor<R, P> visitor, P param);
}
