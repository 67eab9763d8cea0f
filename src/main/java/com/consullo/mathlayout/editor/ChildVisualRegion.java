package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.SourceRange;

/**
 * Part of a compound node's box that maps to one editable child, in coordinates local to the
 * compound's entry.
 *
 * @param childRange editable source range of the child
 * @param xStart left edge
 * @param xEnd right edge
 * @param yStart top edge
 * @param yEnd bottom edge
 * @since 1.0
 */
public record ChildVisualRegion(SourceRange childRange, float xStart, float xEnd, float yStart, float yEnd) {

  public ChildVisualRegion {
    if (childRange == null) {
      throw new IllegalArgumentException("childRange must not be null.");
    }
  }

  public float centerX() {
    return (xStart + xEnd) / 2f;
  }

  public float centerY() {
    return (yStart + yEnd) / 2f;
  }

  /**
   * Point containment with inclusive edges.
   *
   * @param localX x relative to the entry
   * @param localY y relative to the entry
   * @return true when the point is on or inside the region
   */
  public boolean containsPoint(float localX, float localY) {
    return localX >= xStart && localX <= xEnd && localY >= yStart && localY <= yEnd;
  }

  /**
   * Horizontal position of {@code localX} as a fraction of the region width, clamped to [0, 1].
   *
   * @param localX x relative to the entry
   * @return ratio, 0 for a zero-width region
   */
  public float horizontalRatio(float localX) {
    float width = xEnd - xStart;
    if (width <= 0f) {
      return 0f;
    }
    return Math.max(0f, Math.min(1f, (localX - xStart) / width));
  }
}
