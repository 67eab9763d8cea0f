package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Explicit horizontal space from {@code \hspace{...}}, already converted to em.
 *
 * @param widthEm width in em
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record HSpaceNode(float widthEm, SourceRange sourceRange) implements MathNode {

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitHSpace(this, param);
  }
}
