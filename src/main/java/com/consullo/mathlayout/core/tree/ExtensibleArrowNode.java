package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \xrightarrow[below]{content}} and friends: an arrow stretched to fit its labels.
 *
 * @param content label above the arrow
 * @param below label below the arrow, may be null
 * @param direction arrow heads to draw
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record ExtensibleArrowNode(MathNode content, MathNode below, Direction direction, SourceRange sourceRange)
    implements MathNode {

  /**
   * Arrow head placement.
   */
  public enum Direction {
    RIGHT,
    LEFT,
    BOTH
  }

  public ExtensibleArrowNode {
    if (content == null || direction == null) {
      throw new IllegalArgumentException("content/direction must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.present(content, below);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitExtensibleArrow(this, param);
  }
}
