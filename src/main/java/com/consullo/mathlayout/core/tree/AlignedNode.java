package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Equation environments aligned at {@code &}: {@code aligned}, {@code split} and
 * {@code eqnarray}.
 *
 * @param rows cells row by row
 * @param environment which environment, decides the column alignment
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record AlignedNode(List<List<MathNode>> rows, Environment environment, SourceRange sourceRange)
    implements MathNode {

  public enum Environment {
    /** Columns alternate right, left. */
    ALIGNED,
    /** Same columns as {@link #ALIGNED}. */
    SPLIT,
    /** Right, center, left. */
    EQNARRAY
  }

  public AlignedNode {
    if (environment == null) {
      throw new IllegalArgumentException("environment must not be null.");
    }
    rows = NodeLists.copyRows(rows);
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.flatten(rows);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitAligned(this, param);
  }
}
