package com.consullo.mathlayout.core;

/**
 * Measured box of a node: size, baseline and the callback that paints it.
 *
 * <p>
 * {@code baseline} is measured from the top edge. Layouts are created fresh per measurement
 * call and are never mutated, so callers may memoize them freely.
 * </p>
 *
 * @param width box width in pixels
 * @param height box height in pixels
 * @param baseline distance from the top edge to the baseline
 * @param painter draw callback invoked with the box's top-left corner
 * @since 1.0
 */
public record NodeLayout(float width, float height, float baseline, Painter painter) {

  public NodeLayout {
    if (painter == null) {
      throw new IllegalArgumentException("painter must not be null.");
    }
  }

  /**
   * Creates an invisible box of the given size.
   *
   * @param width width
   * @param height height
   * @param baseline baseline
   * @return layout that paints nothing
   */
  public static NodeLayout blank(final float width, final float height, final float baseline) {
    return new NodeLayout(width, height, baseline, Painter.NONE);
  }

  public static NodeLayout empty() {
    return blank(0f, 0f, 0f);
  }

  public float ascent() {
    return baseline;
  }

  public float descent() {
    return height - baseline;
  }

  public void draw(final Canvas canvas, final float x, final float y) {
    painter.paint(canvas, x, y);
  }
}
