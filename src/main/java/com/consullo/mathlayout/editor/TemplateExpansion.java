package com.consullo.mathlayout.editor;

/**
 * Text produced by a {@link LatexTemplate} and where the caret goes within it.
 *
 * @param text inserted text
 * @param cursorDelta caret offset relative to the insertion point
 * @since 1.0
 */
public record TemplateExpansion(String text, int cursorDelta) {

  public TemplateExpansion {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null.");
    }
    if (cursorDelta < 0 || cursorDelta > text.length()) {
      throw new IllegalArgumentException("cursorDelta must lie within text.");
    }
  }
}
