package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Line break ({@code \\}). Splits the enclosing sequence into stacked lines.
 *
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record NewLineNode(SourceRange sourceRange) implements MathNode {

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitNewLine(this, param);
  }
}
