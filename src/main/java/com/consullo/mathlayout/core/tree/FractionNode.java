package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \frac{numerator}{denominator}}.
 *
 * @param numerator upper part
 * @param denominator lower part
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record FractionNode(MathNode numerator, MathNode denominator, SourceRange sourceRange) implements MathNode {

  public FractionNode {
    if (numerator == null || denominator == null) {
      throw new IllegalArgumentException("numerator/denominator must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of(numerator, denominator);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitFraction(this, param);
  }
}
