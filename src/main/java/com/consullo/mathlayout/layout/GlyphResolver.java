package com.consullo.mathlayout.layout;

import java.util.Map;

/**
 * Maps operator and delimiter commands to the characters that are painted, and compensates font
 * weight for glyphs drawn larger than their design size.
 *
 * @since 1.0
 */
public final class GlyphResolver {

  private static final Map<String, String> BIG_OPERATORS = Map.ofEntries(
      Map.entry("sum", "∑"),
      Map.entry("prod", "∏"),
      Map.entry("coprod", "∐"),
      Map.entry("int", "∫"),
      Map.entry("oint", "∮"),
      Map.entry("iint", "∬"),
      Map.entry("iiint", "∭"),
      Map.entry("bigcap", "⋂"),
      Map.entry("bigcup", "⋃"),
      Map.entry("bigsqcup", "⨆"),
      Map.entry("bigvee", "⋁"),
      Map.entry("bigwedge", "⋀"),
      Map.entry("bigoplus", "⨁"),
      Map.entry("bigotimes", "⨂"),
      Map.entry("biguplus", "⨄"));

  private static final Map<String, String> DELIMITERS = Map.ofEntries(
      Map.entry("\\{", "{"),
      Map.entry("\\}", "}"),
      Map.entry("\\langle", "⟨"),
      Map.entry("\\rangle", "⟩"),
      Map.entry("\\lfloor", "⌊"),
      Map.entry("\\rfloor", "⌋"),
      Map.entry("\\lceil", "⌈"),
      Map.entry("\\rceil", "⌉"),
      Map.entry("\\vert", "|"),
      Map.entry("\\|", "‖"),
      Map.entry("\\Vert", "‖"));

  private GlyphResolver() {
  }

  /**
   * Character for a big operator name; unknown names (e.g. {@code lim}) are returned trimmed.
   *
   * @param name operator name
   * @return glyph text
   */
  public static String bigOperatorGlyph(final String name) {
    String trimmed = name.trim();
    return BIG_OPERATORS.getOrDefault(trimmed, trimmed);
  }

  public static String delimiterGlyph(final String delimiter) {
    return DELIMITERS.getOrDefault(delimiter, delimiter);
  }

  /**
   * Lighter weight for glyphs scaled up, so strokes do not thicken visibly: unchanged at scale 1,
   * 100 at scale 2 and above, linear in between.
   *
   * @param baseWeight weight at design size
   * @param scaleFactor size multiplier
   * @return compensated weight
   */
  public static int compensatedFontWeight(final int baseWeight, final float scaleFactor) {
    if (scaleFactor <= 1.0f) {
      return baseWeight;
    }
    if (scaleFactor >= 2.0f) {
      return MathConstants.BIG_OP_SYMBOL_MIN_WEIGHT;
    }
    float t = scaleFactor - 1.0f;
    int weight = (int) (baseWeight - t * (baseWeight - MathConstants.BIG_OP_SYMBOL_MIN_WEIGHT));
    return Math.max(MathConstants.BIG_OP_SYMBOL_MIN_WEIGHT, Math.min(baseWeight, weight));
  }
}
