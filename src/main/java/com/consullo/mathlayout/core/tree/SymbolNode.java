package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Named symbol such as {@code \alpha} or {@code \leq}.
 *
 * @param name command name without the backslash
 * @param unicode rendered character, may be empty
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SymbolNode(String name, String unicode, SourceRange sourceRange) implements MathNode {

  public SymbolNode {
    if (name == null || unicode == null) {
      throw new IllegalArgumentException("name/unicode must not be null.");
    }
  }

  /**
   * Text painted for this symbol: the unicode form when known, otherwise the name.
   *
   * @return display text
   */
  public String displayText() {
    return unicode.isEmpty() ? name : unicode;
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSymbol(this, param);
  }
}
