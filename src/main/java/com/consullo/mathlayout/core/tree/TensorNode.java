package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tensor with staggered indices, e.g. {@code \tensor{T}{^a_b^c}}. Each index occupies its own
 * column after the base.
 *
 * @param base tensor symbol
 * @param indices indices in source order
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record TensorNode(MathNode base, List<Index> indices, SourceRange sourceRange) implements MathNode {

  /**
   * One raised or lowered index.
   *
   * @param upper true for a contravariant (raised) index
   * @param script index content
   */
  public record Index(boolean upper, MathNode script) {

    public Index {
      if (script == null) {
        throw new IllegalArgumentException("script must not be null.");
      }
    }
  }

  public TensorNode {
    if (base == null || indices == null) {
      throw new IllegalArgumentException("base/indices must not be null.");
    }
    indices = List.copyOf(indices);
  }

  @Override
  public List<MathNode> children() {
    List<MathNode> out = new ArrayList<>(indices.size() + 1);
    out.add(base);
    for (Index index : indices) {
      out.add(index.script());
    }
    return Collections.unmodifiableList(out);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitTensor(this, param);
  }
}
