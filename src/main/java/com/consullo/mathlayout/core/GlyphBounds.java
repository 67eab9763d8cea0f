package com.consullo.mathlayout.core;

/**
 * Tight ink bounds of a glyph run relative to its baseline.
 *
 * @param ascent ink extent above the baseline
 * @param descent ink extent below the baseline
 * @param inkWidth width of the painted area
 * @since 1.0
 */
public record GlyphBounds(float ascent, float descent, float inkWidth) {

  public float inkHeight() {
    return ascent + descent;
  }
}
