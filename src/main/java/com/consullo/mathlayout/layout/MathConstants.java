package com.consullo.mathlayout.layout;

/**
 * Typesetting parameters shared by the measurers.
 *
 * <p>
 * Unless the name ends in {@code _DP}, a value is a ratio of the current font size. {@code _DP}
 * values are device-independent units converted with {@link
 * com.consullo.mathlayout.core.RenderContext#dp(float)}. Several values, notably the accent and
 * ink-estimate coefficients, are tuned by eye against common math fonts rather than derived from
 * font tables.
 * </p>
 *
 * @since 1.0
 */
public final class MathConstants {

  private MathConstants() {
  }

  // Fractions
  public static final float FRACTION_RULE_THICKNESS = 0.05f;
  public static final float FRACTION_GAP = 0.15f;
  public static final float FRACTION_RULE_INSET = 0.075f;

  // Radicals
  public static final float RADICAL_RULE_THICKNESS = 0.05f;
  public static final float RADICAL_HOOK_WIDTH = 0.3f;
  public static final float RADICAL_INDEX_SCALE = 0.6f;
  public static final float RADICAL_TOP_GAP_MULTIPLIER = 2f;

  // Scripts
  public static final float SUPERSCRIPT_SHIFT = 0.45f;
  public static final float SUBSCRIPT_SHIFT = 0.25f;
  public static final float SCRIPT_KERN_DP = 1f;
  public static final float BRACE_ANNOTATION_GAP = 0.08f;

  // Big operators
  public static final float BIG_OP_DISPLAY_SCALE = 1.5f;
  public static final float BIG_OP_INLINE_SCALE = 1.2f;
  public static final float BIG_OP_DEFAULT_SCALE = 1.3f;
  public static final float BIG_OP_NAMED_VISUAL_HEIGHT = 0.8f;
  public static final int BIG_OP_SYMBOL_BASE_WEIGHT = 400;
  public static final int BIG_OP_SYMBOL_MIN_WEIGHT = 100;
  public static final int BIG_OP_VERTICAL_SCALE_WEIGHT_REDUCTION = 200;
  public static final float INTEGRAL_VISUAL_WIDTH = 0.22f;
  public static final float NAMED_OP_CHAR_WIDTH = 0.45f;
  public static final float NAMED_OP_LIMIT_GAP = 0.02f;
  public static final float NAMED_OP_SIDE_LIMIT_GAP = 0.03f;
  public static final float NAMED_OP_SIDE_LIMIT_GAP_FACTOR = 2.5f;
  public static final float SYMBOL_OP_LIMIT_GAP = 0.2f;
  public static final float INTEGRAL_SUBSCRIPT_OVERLAP = 0.85f;
  public static final float INTEGRAL_SUBSCRIPT_INSET = 0.12f;
  public static final float INTEGRAL_HEIGHT_HINT_OVERSHOOT = 1.05f;
  /** Exponent splitting an integral stretch between font size and canvas scale. */
  public static final float INTEGRAL_FONT_SCALE_RATIO = 0.5f;
  public static final float BIG_OP_WIDTH_OVERFLOW_FACTOR = 1.1f;

  // Delimiters and binomials
  public static final float DELIMITER_PADDING = 0.15f;
  public static final float DELIMITER_COMPRESS_THRESHOLD = 1.5f;
  public static final float DELIMITER_MAX_COMPRESSION = 1.6f;
  public static final float BINOMIAL_CHILD_SCALE = 0.9f;
  public static final float BINOMIAL_GAP = 0.2f;

  // Accents
  public static final float ACCENT_SCALE = 0.8f;
  public static final float ACCENT_HAT_HEIGHT = 0.52f;
  public static final float ACCENT_HAT_OFFSET = 0.10f;
  public static final float ACCENT_TILDE_HEIGHT = 0.48f;
  public static final float ACCENT_TILDE_OFFSET = 0.13f;
  public static final float ACCENT_BAR_HEIGHT = 0.22f;
  public static final float ACCENT_BAR_OFFSET = 0.12f;
  public static final float ACCENT_VEC_HEIGHT = 0.46f;
  public static final float ACCENT_VEC_OFFSET = 0f;
  public static final float ACCENT_DOT_HEIGHT = 0.26f;
  public static final float ACCENT_DOT_OFFSET = 0.15f;
  public static final float ACCENT_DDOT_HEIGHT = 0.30f;
  public static final float ACCENT_DDOT_OFFSET = 0.15f;
  public static final float ACCENT_DEFAULT_HEIGHT = 0.45f;
  public static final float ACCENT_DEFAULT_OFFSET = 0.24f;
  public static final float ACCENT_ITALIC_CORRECTION = 0.08f;
  public static final float ACCENT_MAX_OVERLAP = 0.9f;
  public static final float WIDE_ACCENT_ARROW_HEIGHT = 0.18f;
  public static final float WIDE_ACCENT_DEFAULT_HEIGHT = 0.3f;
  public static final float WIDE_ACCENT_ARROW_GAP = 0.02f;
  public static final float WIDE_ACCENT_DEFAULT_GAP = 0.08f;
  public static final float WIDE_ACCENT_STROKE_DP = 1.5f;
  public static final float WIDE_ACCENT_BRACE_STROKE_DP = 1.2f;
  public static final float WIDE_ACCENT_LINE_HEIGHT_DP = 2f;
  public static final float WIDE_ACCENT_ARROW_HEAD_DP = 4f;

  // Stacks
  public static final float STACK_SCRIPT_SCALE = 0.7f;
  public static final float STACK_GAP = 0.08f;

  // Extensible arrows
  public static final float EXTENSIBLE_ARROW_LABEL_SCALE = 0.7f;
  public static final float EXTENSIBLE_ARROW_MIN_LENGTH_DP = 30f;
  public static final float EXTENSIBLE_ARROW_PADDING_DP = 4f;
  public static final float EXTENSIBLE_ARROW_HEAD_DP = 5f;
  public static final float EXTENSIBLE_ARROW_STROKE_DP = 1.5f;
  public static final float EXTENSIBLE_ARROW_STROKE_HEIGHT_DP = 2f;
  public static final float EXTENSIBLE_ARROW_TEXT_GAP_DP = 2f;

  // Matrices and aligned environments
  public static final float MATRIX_COLUMN_SPACING = 0.5f;
  public static final float MATRIX_ROW_SPACING = 0.2f;
  public static final float MULTLINE_ROW_SPACING = 0.3f;

  // Special effects
  public static final float BOXED_PADDING = 0.15f;
  public static final float BOXED_BORDER_DP = 1f;

  // Lines and axis
  public static final float LINE_SPACING = 0.25f;
  public static final float MATH_AXIS_HEIGHT_RATIO = 0.25f;
  public static final float MATH_AXIS_MIN_RATIO = 0.1f;
  public static final float MATH_AXIS_MAX_RATIO = 0.5f;
}
