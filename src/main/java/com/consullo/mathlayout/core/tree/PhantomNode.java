package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \phantom}, {@code \hphantom} and {@code \vphantom}: invisible content that reserves
 * space.
 *
 * @param content measured but unpainted nodes
 * @param kind which dimensions are kept
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record PhantomNode(List<MathNode> content, Kind kind, SourceRange sourceRange) implements MathNode {

  /**
   * Kept dimensions.
   */
  public enum Kind {
    /** Width, height and baseline. */
    PHANTOM,
    /** Width only. */
    HPHANTOM,
    /** Height and baseline only. */
    VPHANTOM
  }

  public PhantomNode {
    if (kind == null) {
      kind = Kind.PHANTOM;
    }
    content = NodeLists.copy(content);
  }

  @Override
  public List<MathNode> children() {
    return content;
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitPhantom(this, param);
  }
}
