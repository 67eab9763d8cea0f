package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects boxes placed at an x offset and a baseline shift, then builds the enclosing layout.
 * The resulting baseline is the shared reference line all shifts are measured from.
 */
final class BaselineRow {

  private final List<Placed> items = new ArrayList<>();
  private float top;
  private float bottom;

  private record Placed(NodeLayout layout, float x, float relY) {
  }

  /**
   * @param layout box
   * @param x left edge
   * @param relY box baseline relative to the row baseline, negative is up
   * @return this row
   */
  BaselineRow add(final NodeLayout layout, final float x, final float relY) {
    items.add(new Placed(layout, x, relY));
    top = Math.min(top, relY - layout.baseline());
    bottom = Math.max(bottom, relY + layout.descent());
    return this;
  }

  NodeLayout build(final float width) {
    final List<Placed> placed = List.copyOf(items);
    final float baseline = -top;
    return new NodeLayout(width, bottom - top, baseline, (canvas, x, y) -> {
      for (Placed item : placed) {
        item.layout().draw(canvas, x + item.x(), y + baseline + item.relY() - item.layout().baseline());
      }
    });
  }
}
