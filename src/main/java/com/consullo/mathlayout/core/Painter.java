package com.consullo.mathlayout.core;

/**
 * Draw callback stored in a {@link NodeLayout}.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Painter {

  /** Painter that draws nothing. */
  Painter NONE = (canvas, x, y) -> {
  };

  /**
   * Paint the laid-out node with its top-left corner at {@code (x, y)}.
   *
   * @param canvas target canvas
   * @param x left edge in pixels
   * @param y top edge in pixels
   */
  void paint(Canvas canvas, float x, float y);
}
