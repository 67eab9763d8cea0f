package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Font-variant switch such as {@code \mathbf{...}} or {@code \mathrm{...}}.
 *
 * @param variant requested variant
 * @param content styled nodes
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record StyleNode(Variant variant, List<MathNode> content, SourceRange sourceRange) implements MathNode {

  /**
   * Supported font variants.
   */
  public enum Variant {
    BOLD,
    ITALIC,
    ROMAN,
    SANS_SERIF,
    MONOSPACE,
    BLACKBOARD_BOLD
  }

  public StyleNode {
    if (variant == null) {
      throw new IllegalArgumentException("variant must not be null.");
    }
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitStyle(this, param);
  }
}
