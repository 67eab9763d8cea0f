package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Cell grid of the {@code matrix} family ({@code pmatrix}, {@code bmatrix}, ...) and of
 * {@code array}, which parses to {@link Bracket#PLAIN}. Rows may have different lengths.
 *
 * @param rows cells row by row
 * @param bracket surrounding delimiters
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record MatrixNode(List<List<MathNode>> rows, Bracket bracket, SourceRange sourceRange) implements MathNode {

  /**
   * Delimiter pair drawn around the grid.
   */
  public enum Bracket {
    PLAIN("", ""),
    PAREN("(", ")"),
    BRACKET("[", "]"),
    BRACE("{", "}"),
    VBAR("|", "|"),
    DOUBLE_VBAR("‖", "‖");

    private final String left;
    private final String right;

    Bracket(String left, String right) {
      this.left = left;
      this.right = right;
    }

    public String left() {
      return left;
    }

    public String right() {
      return right;
    }
  }

  public MatrixNode {
    if (bracket == null) {
      throw new IllegalArgumentException("bracket must not be null.");
    }
    rows = NodeLists.copyRows(rows);
  }

  @Override
  public List<MathNode> children() {
    return NodeLists.flatten(rows);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitMatrix(this, param);
  }
}
