package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Explicit style level switch such as {@code \displaystyle}.
 *
 * @param level target level
 * @param content nodes rendered at that level
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record MathStyleNode(MathStyle level, List<MathNode> content, SourceRange sourceRange) implements MathNode {

  public MathStyleNode {
    if (level == null) {
      throw new IllegalArgumentException("level must not be null.");
    }
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitMathStyle(this, param);
  }
}
