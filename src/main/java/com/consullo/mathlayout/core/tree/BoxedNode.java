package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \boxed{...}}: content framed by a rectangle.
 *
 * @param content framed nodes
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record BoxedNode(List<MathNode> content, SourceRange sourceRange) implements MathNode {

  public BoxedNode {
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitBoxed(this, param);
  }
}
