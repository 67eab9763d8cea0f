package com.consullo.mathlayout.editor;

/**
 * Caret geometry in surface coordinates, padding included.
 *
 * @param x caret x
 * @param y caret top
 * @param height caret height
 * @since 1.0
 */
public record CursorPosition(float x, float y, float height) {
}
