package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Root of a parsed expression.
 *
 * @param children child nodes in document order
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record DocumentNode(List<MathNode> children, SourceRange sourceRange) implements MathNode {

  public DocumentNode {
    children = NodeLists.copy(children);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitDocument(this, param);
  }
}
