package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.SourceRange;

/**
 * What to highlight: either a source range or a run of top-level entries by index.
 *
 * @param range source range, or null when selecting by index
 * @param firstIndex first top-level entry index, inclusive (index mode only)
 * @param lastIndex last top-level entry index, inclusive (index mode only)
 * @param argb fill color
 * @since 1.0
 */
public record HighlightSpec(SourceRange range, int firstIndex, int lastIndex, int argb) {

  public HighlightSpec {
    if (range == null && (firstIndex < 0 || lastIndex < firstIndex)) {
      throw new IllegalArgumentException("index range must satisfy 0 <= firstIndex <= lastIndex.");
    }
  }

  public static HighlightSpec ofRange(SourceRange range, int argb) {
    if (range == null) {
      throw new IllegalArgumentException("range must not be null.");
    }
    return new HighlightSpec(range, -1, -1, argb);
  }

  public static HighlightSpec ofIndices(int firstIndex, int lastIndex, int argb) {
    return new HighlightSpec(null, firstIndex, lastIndex, argb);
  }

  public boolean isIndexBased() {
    return range == null;
  }
}
