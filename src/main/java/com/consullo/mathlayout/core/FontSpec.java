package com.consullo.mathlayout.core;

/**
 * Font request passed to a {@link Shaper}.
 *
 * @param family family handle
 * @param sizePx font size in pixels
 * @param weight CSS-style weight, 100 to 900
 * @param italic whether an italic face is requested
 * @since 1.0
 */
public record FontSpec(FontFamily family, float sizePx, int weight, boolean italic) {

  public FontSpec {
    if (family == null) {
      throw new IllegalArgumentException("family must not be null.");
    }
    if (!(sizePx > 0f)) {
      throw new IllegalArgumentException("sizePx must be positive.");
    }
  }

  public FontSpec withSize(float newSizePx) {
    return new FontSpec(family, newSizePx, weight, italic);
  }

  public FontSpec withWeight(int newWeight) {
    return new FontSpec(family, sizePx, newWeight, italic);
  }
}
