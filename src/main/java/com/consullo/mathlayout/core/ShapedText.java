package com.consullo.mathlayout.core;

/**
 * Metrics of a shaped run of text, in pixels.
 *
 * <p>
 * {@code height} is the full line box and {@code baseline} the distance from its top to the
 * baseline. A canvas repaints the run from {@code text} and {@code font}.
 * </p>
 *
 * @param text shaped text
 * @param font font it was shaped with
 * @param width advance width
 * @param height line box height
 * @param baseline first baseline measured from the top of the line box
 * @since 1.0
 */
public record ShapedText(String text, FontSpec font, float width, float height, float baseline) {
}
