package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * {@code \sideset{_a^b}{_c^d}\sum}: scripts on both sides of a base, usually a big operator.
 *
 * @param leftSub lower-left script, may be null
 * @param leftSup upper-left script, may be null
 * @param rightSub lower-right script, may be null
 * @param rightSup upper-right script, may be null
 * @param base decorated base
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record SideSetNode(
    MathNode leftSub,
    MathNode leftSup,
    MathNode rightSub,
    MathNode rightSup,
    MathNode base,
    SourceRange sourceRange) implements MathNode {

  public SideSetNode {
    if (base == null) {
      throw new IllegalArgumentException("base must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.present(leftSub, leftSup, base, rightSub, rightSup);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitSideSet(this, param);
  }
}
