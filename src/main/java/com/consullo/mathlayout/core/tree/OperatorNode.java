package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Named function operator set upright, such as {@code \sin} or {@code \log}.
 *
 * @param name operator text
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record OperatorNode(String name, SourceRange sourceRange) implements MathNode {

  public OperatorNode {
    if (name == null) {
      throw new IllegalArgumentException("name must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitOperator(this, param);
  }
}
