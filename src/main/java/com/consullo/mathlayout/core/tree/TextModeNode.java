package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Upright prose inside math, from {@code \text{...}}.
 *
 * @param text text content
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record TextModeNode(String text, SourceRange sourceRange) implements MathNode {

  public TextModeNode {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitTextMode(this, param);
  }
}
