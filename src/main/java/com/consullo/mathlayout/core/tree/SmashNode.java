package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \smash{...}}: content painted normally but contributing no height or depth.
 *
 * @param content smashed nodes
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SmashNode(List<MathNode> content, SourceRange sourceRange) implements MathNode {

  public SmashNode {
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSmash(this, param);
  }
}
