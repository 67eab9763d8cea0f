package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.AlignedNode;
import com.consullo.mathlayout.core.tree.CasesNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.MatrixNode;
import com.consullo.mathlayout.core.tree.MultlineNode;
import com.consullo.mathlayout.core.tree.SimpleMathNodeVisitor;
import com.consullo.mathlayout.core.tree.TextModeNode;
import com.consullo.mathlayout.layout.DelimiterScaler;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays out cell grids: matrices, arrays, cases and the aligned equation environments.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Every cell is measured on its own; a column is as wide as its widest cell.</li>
 * <li>Cells of a row share a baseline; a row is as tall as its tallest ascent plus its deepest
 * descent.</li>
 * <li>The grid is centered on the math axis.</li>
 * <li>Delimiters, where the environment has them, are stretched to the grid plus padding.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class MatrixMeasurer implements NodeMeasurer<MathNode> {

  /**
   * Horizontal placement of a cell inside its column.
   */
  public enum ColumnAlignment {
    LEFT,
    CENTER,
    RIGHT
  }

  private static final List<ColumnAlignment> CASES_ALIGNMENT =
      List.of(ColumnAlignment.LEFT, ColumnAlignment.CENTER, ColumnAlignment.LEFT);
  private static final List<ColumnAlignment> EQNARRAY_ALIGNMENT =
      List.of(ColumnAlignment.RIGHT, ColumnAlignment.CENTER, ColumnAlignment.LEFT);
  private static final String CASES_CONNECTIVE = " if ";

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    return node.accept(new GridVisitor(scope), context);
  }

  /**
   * Column alignment for an aligned environment. {@code aligned} and {@code split} alternate
   * right and left so that relations line up at the {@code &}.
   */
  static ColumnAlignment alignmentOf(AlignedNode.Environment environment, int column) {
    if (environment == AlignedNode.Environment.EQNARRAY) {
      return column < EQNARRAY_ALIGNMENT.size() ? EQNARRAY_ALIGNMENT.get(column) : ColumnAlignment.CENTER;
    }
    return column % 2 == 0 ? ColumnAlignment.RIGHT : ColumnAlignment.LEFT;
  }

  private static final class GridVisitor extends SimpleMathNodeVisitor<NodeLayout, RenderContext> {

    private final MeasureScope scope;

    private GridVisitor(MeasureScope scope) {
      this.scope = scope;
    }

    @Override
    protected NodeLayout defaultAction(MathNode node, RenderContext context) {
      throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    @Override
    public NodeLayout visitMatrix(MatrixNode node, RenderContext context) {
      final NodeLayout grid = grid(node.rows(), context, column -> ColumnAlignment.CENTER);
      if (node.bracket() == MatrixNode.Bracket.PLAIN) {
        return grid;
      }
      return bracket(grid, node.bracket().left(), node.bracket().right(), context);
    }

    @Override
    public NodeLayout visitCases(CasesNode node, RenderContext context) {
      List<List<MathNode>> rows = new ArrayList<>(node.cases().size());
      for (CasesNode.Case branch : node.cases()) {
        if (branch.condition() == null) {
          rows.add(List.of(branch.value()));
        } else {
          rows.add(List.of(branch.value(), new TextModeNode(CASES_CONNECTIVE, null), branch.condition()));
        }
      }
      final NodeLayout grid = grid(rows, context, CASES_ALIGNMENT::get);
      return bracket(grid, "{", "", context);
    }

    @Override
    public NodeLayout visitAligned(AlignedNode node, RenderContext context) {
      return grid(node.rows(), context, column -> alignmentOf(node.environment(), column));
    }

    @Override
    public NodeLayout visitMultline(MultlineNode node, RenderContext context) {
      final List<NodeLayout> lines = new ArrayList<>(node.lines().size());
      for (MathNode line : node.lines()) {
        lines.add(scope.measure(line, context));
      }
      if (lines.isEmpty()) {
        return NodeLayout.empty();
      }

      final float spacing = context.getFontSizePx() * MathConstants.MULTLINE_ROW_SPACING;
      float width = 0f;
      float height = 0f;
      for (NodeLayout line : lines) {
        width = Math.max(width, line.width());
        height += line.height();
      }
      height += spacing * (lines.size() - 1);
      final float totalWidth = width;
      final int last = lines.size() - 1;

      return new NodeLayout(totalWidth, height, lines.get(0).baseline(), (canvas, x, y) -> {
        float top = y;
        for (int i = 0; i < lines.size(); i++) {
          NodeLayout line = lines.get(i);
          float offset;
          if (i == 0) {
            offset = 0f;
          } else if (i == last) {
            offset = totalWidth - line.width();
          } else {
            offset = (totalWidth - line.width()) / 2f;
          }
          line.draw(canvas, x + offset, top);
          top += line.height() + spacing;
        }
      });
    }

    private NodeLayout grid(List<List<MathNode>> rows, RenderContext context, Alignment alignment) {
      if (rows.isEmpty()) {
        return NodeLayout.empty();
      }

      // Step A: measure every cell
      final List<List<NodeLayout>> cells = new ArrayList<>(rows.size());
      int columns = 0;
      for (List<MathNode> row : rows) {
        List<NodeLayout> measured = new ArrayList<>(row.size());
        for (MathNode cell : row) {
          measured.add(scope.measure(cell, context));
        }
        cells.add(measured);
        columns = Math.max(columns, measured.size());
      }

      // Step B: column widths, row ascents and descents
      final float[] columnWidths = new float[columns];
      final float[] rowHeights = new float[cells.size()];
      final float[] rowBaselines = new float[cells.size()];
      for (int r = 0; r < cells.size(); r++) {
        float ascent = 0f;
        float descent = 0f;
        List<NodeLayout> row = cells.get(r);
        for (int c = 0; c < row.size(); c++) {
          NodeLayout cell = row.get(c);
          columnWidths[c] = Math.max(columnWidths[c], cell.width());
          ascent = Math.max(ascent, cell.ascent());
          descent = Math.max(descent, cell.descent());
        }
        rowHeights[r] = ascent + descent;
        rowBaselines[r] = ascent;
      }

      // Step C: total size, centered on the axis
      final float fontSize = context.getFontSizePx();
      final float columnSpacing = fontSize * MathConstants.MATRIX_COLUMN_SPACING;
      final float rowSpacing = fontSize * MathConstants.MATRIX_ROW_SPACING;
      float width = columnSpacing * Math.max(0, columns - 1);
      for (float columnWidth : columnWidths) {
        width += columnWidth;
      }
      float height = rowSpacing * Math.max(0, cells.size() - 1);
      for (float rowHeight : rowHeights) {
        height += rowHeight;
      }
      final float baseline = height / 2f + scope.axisHeight(context);

      return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
        float top = y;
        for (int r = 0; r < cells.size(); r++) {
          List<NodeLayout> row = cells.get(r);
          float left = x;
          for (int c = 0; c < row.size(); c++) {
            NodeLayout cell = row.get(c);
            float cellX;
            switch (alignment.of(c)) {
              case LEFT:
                cellX = left;
                break;
              case RIGHT:
                cellX = left + columnWidths[c] - cell.width();
                break;
              default:
                cellX = left + (columnWidths[c] - cell.width()) / 2f;
                break;
            }
            cell.draw(canvas, cellX, top + rowBaselines[r] - cell.baseline());
            left += columnWidths[c] + columnSpacing;
          }
          top += rowHeights[r] + rowSpacing;
        }
      });
    }

    private NodeLayout bracket(NodeLayout content, String leftGlyph, String rightGlyph, RenderContext context) {
      final float padding = context.getFontSizePx() * MathConstants.DELIMITER_PADDING;
      final float height = content.height() + padding * 2f;
      final NodeLayout left = leftGlyph.isEmpty()
          ? NodeLayout.blank(0f, 0f, 0f)
          : DelimiterScaler.measureScaled(leftGlyph, context, scope.shaper(), height);
      final NodeLayout right = rightGlyph.isEmpty()
          ? NodeLayout.blank(0f, 0f, 0f)
          : DelimiterScaler.measureScaled(rightGlyph, context, scope.shaper(), height);
      final float width = left.width() + content.width() + right.width();

      return new NodeLayout(width, height, content.baseline() + padding, (canvas, x, y) -> {
        left.draw(canvas, x, y);
        content.draw(canvas, x + left.width(), y + padding);
        right.draw(canvas, x + left.width() + content.width(), y);
      });
    }
  }

  @FunctionalInterface
  private interface Alignment {
    ColumnAlignment of(int column);
  }
}
