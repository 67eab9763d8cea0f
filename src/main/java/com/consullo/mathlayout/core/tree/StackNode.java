package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \overset}, <code>&#92;underset</code> and {@code \stackrel}: a base with content stacked above,
 * below or both.
 *
 * @param base base node
 * @param above node above, may be null
 * @param below node below, may be null
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record StackNode(MathNode base, MathNode above, MathNode below, SourceRange sourceRange) implements MathNode {

  public StackNode {
    if (base == null) {
      throw new IllegalArgumentException("base must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.present(above, base, below);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitStack(this, param);
  }
}
