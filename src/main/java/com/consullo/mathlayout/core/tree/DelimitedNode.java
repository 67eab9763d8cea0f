package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \left( ... \right)} with delimiters stretched to the content. A delimiter of {@code "."}
 * is invisible.
 *
 * @param left opening delimiter
 * @param right closing delimiter
 * @param content enclosed nodes
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record DelimitedNode(String left, String right, List<MathNode> content, SourceRange sourceRange)
    implements MathNode {

  /** Delimiter that takes no space and draws nothing. */
  public static final String NONE = ".";

  public DelimitedNode {
    if (left == null || right == null) {
      throw new IllegalArgumentException("left/right must not be null.");
    }
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitDelimited(this, param);
  }
}
