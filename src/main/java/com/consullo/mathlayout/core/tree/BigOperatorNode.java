package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Large operator with optional limits, e.g. {@code \sum_{i=0}^{n}} or {@code \lim_{x\to 0}}.
 *
 * @param name operator name without the backslash ({@code sum}, {@code int}, {@code lim}, ...)
 * @param subscript lower limit, may be null
 * @param superscript upper limit, may be null
 * @param limitsMode placement of the limits
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record BigOperatorNode(
    String name,
    MathNode subscript,
    MathNode superscript,
    LimitsMode limitsMode,
    SourceRange sourceRange) implements MathNode {

  /**
   * Limit placement: {@code \limits}, {@code \nolimits} or the style-dependent default.
   */
  public enum LimitsMode {
    AUTO,
    LIMITS,
    NOLIMITS
  }

  public BigOperatorNode {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank.");
    }
    if (limitsMode == null) {
      limitsMode = LimitsMode.AUTO;
    }
  }

  public boolean isIntegral() {
    return name.contains("int");
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.present(subscript, superscript);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitBigOperator(this, param);
  }
}
