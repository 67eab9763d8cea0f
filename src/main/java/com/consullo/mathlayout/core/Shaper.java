package com.consullo.mathlayout.core;

import java.util.Optional;

/**
 * Text-measurement capability injected into the layout engine.
 *
 * @since 1.0
 */
public interface Shaper {

  /**
   * Shape {@code text} with the requested font.
   *
   * @param text text to shape, may be empty
   * @param font font request
   * @return shaped metrics
   */
  ShapedText shape(String text, FontSpec font);

  /**
   * Measure the exact ink bounds of {@code text} rendered with the font held in {@code fontBytes}.
   *
   * <p>
   * Implementations that cannot load the bytes return empty and the caller falls back to a
   * heuristic estimate.
   * </p>
   *
   * @param text text to measure
   * @param font size and weight to measure at
   * @param fontBytes raw font file contents
   * @return ink bounds, or empty when unavailable
   */
  default Optional<GlyphBounds> glyphBounds(String text, FontSpec font, byte[] fontBytes) {
    return Optional.empty();
  }
}
