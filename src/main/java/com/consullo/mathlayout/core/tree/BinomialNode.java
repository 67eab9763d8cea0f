package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \binom{top}{bottom}}.
 *
 * @param top upper part
 * @param bottom lower part
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record BinomialNode(MathNode top, MathNode bottom, SourceRange sourceRange) implements MathNode {

  public BinomialNode {
    if (top == null || bottom == null) {
      throw new IllegalArgumentException("top/bottom must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of(top, bottom);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitBinomial(this, param);
  }
}
