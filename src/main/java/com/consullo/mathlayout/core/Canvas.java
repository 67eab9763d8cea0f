package com.consullo.mathlayout.core;

/**
 * Drawing surface consumed by {@link NodeLayout} painters.
 *
 * <p>
 * Coordinates are pixels with y growing downwards. Colors are packed ARGB integers.
 * </p>
 *
 * @since 1.0
 */
public interface Canvas {

  /**
   * Draw shaped text with the top of its line box at {@code (x, y)}.
   *
   * @param text previously shaped text
   * @param x left edge
   * @param y top of the line box
   * @param argb fill color
   */
  void drawGlyphs(ShapedText text, float x, float y, int argb);

  /**
   * Draw a straight stroked line.
   *
   * @param x1 start x
   * @param y1 start y
   * @param x2 end x
   * @param y2 end y
   * @param strokeWidth stroke width
   * @param argb stroke color
   */
  void drawLine(float x1, float y1, float x2, float y2, float strokeWidth, int argb);

  /**
   * Draw a path whose coordinates are relative to {@code (x, y)}.
   *
   * @param path path in local coordinates
   * @param x translation x
   * @param y translation y
   * @param strokeWidth stroke width, or a value {@code <= 0} to fill the path
   * @param argb color
   */
  void drawPath(VectorPath path, float x, float y, float strokeWidth, int argb);

  /**
   * Draw a rectangle outline, or fill it when {@code strokeWidth <= 0}.
   *
   * @param x left edge
   * @param y top edge
   * @param width width
   * @param height height
   * @param strokeWidth stroke width
   * @param argb color
   */
  void drawRect(float x, float y, float width, float height, float strokeWidth, int argb);

  /**
   * Run {@code body} with a scale transform around the given pivot, restoring afterwards.
   *
   * @param scaleX horizontal scale
   * @param scaleY vertical scale
   * @param pivotX pivot x
   * @param pivotY pivot y
   * @param body drawing performed under the transform
   */
  void withScale(float scaleX, float scaleY, float pivotX, float pivotY, Runnable body);
}
