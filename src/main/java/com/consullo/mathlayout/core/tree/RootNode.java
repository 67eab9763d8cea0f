package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \sqrt[index]{content}}.
 *
 * @param content radicand
 * @param index root index, null for a square root
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record RootNode(MathNode content, MathNode index, SourceRange sourceRange) implements MathNode {

  public RootNode {
    if (content == null) {
      throw new IllegalArgumentException("content must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.present(index, content);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitRoot(this, param);
  }
}
