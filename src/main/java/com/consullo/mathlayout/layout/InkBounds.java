package com.consullo.mathlayout.layout;

/**
 * Ink extent of a glyph run expressed against its line box.
 *
 * @param inkHeight height of the painted area
 * @param inkTopOffset distance from the top of the line box to the top of the ink
 * @param inkBaseline distance from the top of the ink to the baseline
 * @since 1.0
 */
public record InkBounds(float inkHeight, float inkTopOffset, float inkBaseline) {
}
