package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code \begin{cases} value & condition \\ ... \end{cases}}.
 *
 * @param cases branches in source order
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record CasesNode(List<Case> cases, SourceRange sourceRange) implements MathNode {

  /**
   * One branch.
   *
   * @param value branch value
   * @param condition guard, may be null for an unconditional branch
   */
  public record Case(MathNode value, MathNode condition) {

    public Case {
      if (value == null) {
        throw new IllegalArgumentException("value must not be null.");
      }
    }
  }

  public CasesNode {
    if (cases == null) {
      throw new IllegalArgumentException("cases must not be null.");
    }
    cases = List.copyOf(cases);
  }

  @Override
  public List<MathNode> children() {
    List<MathNode> out = new ArrayList<>(cases.size() * 2);
    for (Case branch : cases) {
      out.add(branch.value());
      if (branch.condition() != null) {
        out.add(branch.condition());
      }
    }
    return Collections.unmodifiableList(out);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitCases(this, param);
  }
}
