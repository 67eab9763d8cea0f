package com.consullo.mathlayout.editor;

import org.apache.commons.lang3.Validate;

/**
 * Structural snippets an editor can insert, each with the caret placed in its first slot.
 *
 * @since 1.0
 */
public enum LatexTemplate {
  FRACTION("Fraction", "\\frac{}{}", 6),
  SQRT("Square root", "\\sqrt{}", 6),
  NTHROOT("Nth root", "\\sqrt[]{}", 6),
  SUPERSCRIPT("Superscript", "^{}", 2),
  SUBSCRIPT("Subscript", "_{}", 2),
  SUM("Sum", "\\sum_{}^{}", 6),
  INTEGRAL("Integral", "\\int_{}^{}", 6),
  LIMIT("Limit", "\\lim_{}", 6),
  MATRIX("Matrix", "\\begin{pmatrix}  \\\\  \\end{pmatrix}", 16),
  PARENTHESES("Parentheses", "\\left( \\right)", 7),
  OVERLINE("Overline", "\\overline{}", 10),
  VEC("Vector", "\\vec{}", 5),
  HAT("Hat", "\\hat{}", 5);

  private final String displayName;
  private final String template;
  private final int cursorDelta;

  LatexTemplate(String displayName, String template, int cursorDelta) {
    this.displayName = displayName;
    this.template = template;
    this.cursorDelta = cursorDelta;
  }

  public String displayName() {
    return displayName;
  }

  public TemplateExpansion expand() {
    return new TemplateExpansion(template, cursorDelta);
  }

  /**
   * Inserts the template into {@code text} at {@code offset}.
   *
   * @param text current source text
   * @param offset insertion point
   * @return new text with the absolute caret offset
   */
  public TemplateExpansion insertInto(final String text, final int offset) {
    Validate.notNull(text, "text must not be null");
    Validate.isTrue(offset >= 0 && offset <= text.length(), "offset out of range: %d", offset);
    String inserted = text.substring(0, offset) + template + text.substring(offset);
    return new TemplateExpansion(inserted, offset + cursorDelta);
  }
}
