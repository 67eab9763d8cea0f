package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Run of ordinary math text such as {@code x} or {@code 12}.
 *
 * @param content text content
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record TextNode(String content, SourceRange sourceRange) implements MathNode {

  public TextNode {
    if (content == null) {
      throw new IllegalArgumentException("content must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitText(this, param);
  }
}
