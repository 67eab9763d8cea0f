package com.consullo.mathlayout.layout;

/**
 * Layout engine configuration values.
 *
 * @param lineSpacingRatio gap between stacked lines as a ratio of the font size
 * @param stretchIntegrals if true, display-style integrals stretch to the height of the content on their right
 * @since 1.0
 */
public record LayoutEngineConfig(float lineSpacingRatio, boolean stretchIntegrals) {

  public LayoutEngineConfig {
    if (lineSpacingRatio < 0f) {
      throw new IllegalArgumentException("lineSpacingRatio must be non-negative.");
    }
  }

  public static LayoutEngineConfig defaults() {
    return new LayoutEngineConfig(MathConstants.LINE_SPACING, true);
  }
}
