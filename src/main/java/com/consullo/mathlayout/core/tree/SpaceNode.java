package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Fixed-width space command such as {@code \,} or {@code \quad}.
 *
 * @param kind space kind
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SpaceNode(Kind kind, SourceRange sourceRange) implements MathNode {

  /**
   * Space kinds with their width in em.
   */
  public enum Kind {
    THIN(0.166f),
    MEDIUM(0.222f),
    THICK(0.277f),
    QUAD(1f),
    QQUAD(2f),
    NORMAL(0.25f);

    private final float em;

    Kind(float em) {
      this.em = em;
    }

    public float em() {
      return em;
    }
  }

  public SpaceNode {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of();
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSpace(this, param);
  }
}
