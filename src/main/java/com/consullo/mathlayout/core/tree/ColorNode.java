package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Color switch from {@code \color{...}{...}}. The color string is resolved by the parser.
 *
 * @param argb packed ARGB color
 * @param content colored nodes
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record ColorNode(int argb, List<MathNode> content, SourceRange sourceRange) implements MathNode {

  public ColorNode {
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitColor(this, param);
  }
}
