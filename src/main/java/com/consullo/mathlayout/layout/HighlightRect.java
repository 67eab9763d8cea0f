package com.consullo.mathlayout.layout;

/**
 * Highlight rectangle in the padded coordinate space of the rendered formula.
 *
 * @param x left edge
 * @param y top edge
 * @param width width
 * @param height height
 * @param argb fill color
 * @since 1.0
 */
public record HighlightRect(float x, float y, float width, float height, int argb) {
}
