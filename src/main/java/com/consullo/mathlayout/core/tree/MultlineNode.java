package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code multline}: one long equation broken over lines. The first line sits flush left, the last
 * flush right and the rest centered.
 *
 * @param lines one node per line
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record MultlineNode(List<MathNode> lines, SourceRange sourceRange) implements MathNode {

  public MultlineNode {
    lines = NodeLists.copy(lines);
  }

  @Override
  public List<MathNode> children() {
    return lines;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitMultline(this, param);
  }
}
