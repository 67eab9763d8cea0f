package com.consullo.mathlayout.layout;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Computes highlight rectangles from a filled {@link LayoutMap}.
 *
 * <p>
 * Each spec yields the union of the boxes it selects, shifted by the padding the formula is drawn
 * with. Index-based specs address the recorded top-level entries in order; indices past the end
 * are clamped. A spec that selects nothing yields no rectangle.
 * </p>
 *
 * @since 1.0
 */
public final class HighlightCalculator {

  private HighlightCalculator() {
  }

  /**
   * Highlight rectangles, in spec order.
   *
   * @param layoutMap layout of the formula
   * @param specs highlight specs
   * @param horizontalPadding left padding the formula is drawn with
   * @param verticalPadding top padding the formula is drawn with
   * @return rectangles
   */
  public static List<HighlightRect> calculate(
      final LayoutMap layoutMap,
      final List<HighlightSpec> specs,
      final float horizontalPadding,
      final float verticalPadding) {
    Validate.notNull(layoutMap, "layoutMap must not be null");
    Validate.notNull(specs, "specs must not be null");

    List<HighlightRect> out = new ArrayList<>();
    List<NodeLayoutEntry> entries = layoutMap.entries();
    for (HighlightSpec spec : specs) {
      List<NodeLayoutEntry> selected;
      if (spec.isIndexBased()) {
        if (entries.isEmpty() || spec.firstIndex() >= entries.size()) {
          continue;
        }
        selected = entries.subList(spec.firstIndex(), Math.min(spec.lastIndex(), entries.size() - 1) + 1);
      } else {
        selected = layoutMap.entriesInRange(spec.range());
      }
      if (selected.isEmpty()) {
        continue;
      }

      float left = Float.MAX_VALUE;
      float top = Float.MAX_VALUE;
      float right = -Float.MAX_VALUE;
      float bottom = -Float.MAX_VALUE;
      for (NodeLayoutEntry entry : selected) {
        left = Math.min(left, entry.relX());
        top = Math.min(top, entry.relY());
        right = Math.max(right, entry.right());
        bottom = Math.max(bottom, entry.bottom());
      }
      out.add(new HighlightRect(left + horizontalPadding, top + verticalPadding, right - left, bottom - top, spec.argb()));
    }
    return out;
  }
}
