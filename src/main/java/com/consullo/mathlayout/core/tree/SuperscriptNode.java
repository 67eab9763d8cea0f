package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code base^exponent}.
 *
 * @param base base node
 * @param exponent raised script
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SuperscriptNode(MathNode base, MathNode exponent, SourceRange sourceRange) implements MathNode {

  public SuperscriptNode {
    if (base == null || exponent == null) {
      throw new IllegalArgumentException("base/exponent must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of(base, exponent);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSuperscript(this, param);
  }
}
