package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code base_index}.
 *
 * @param base base node
 * @param index lowered script
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SubscriptNode(MathNode base, MathNode index, SourceRange sourceRange) implements MathNode {

  public SubscriptNode {
    if (base == null || index == null) {
      throw new IllegalArgumentException("base/index must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of(base, index);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSubscript(this, param);
  }
}
