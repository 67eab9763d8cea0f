package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Manually sized delimiter such as {@code \big(} or {@code \Bigg]}.
 *
 * @param delimiter delimiter text
 * @param scale size factor ({@code \big} 1.2, {@code \Big} 1.8, {@code \bigg} 2.4, {@code \Bigg} 3.0)
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SizedDelimiterNode(String delimiter, float scale, SourceRange sourceRange) implements MathNode {

  public SizedDelimiterNode {
    if (delimiter == null) {
      throw new IllegalArgumentException("delimiter must not be null.");
    }
    if (!(scale > 0f)) {
      throw new IllegalArgumentException("scale must be positive.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSizedDelimiter(this, param);
  }
}
