package com.consullo.mathlayout.layout;

/**
 * Spacing amounts between atoms, in math units (18 mu = 1 em).
 *
 * @since 1.0
 */
public enum SpaceRule {
  NONE(0f),
  THIN(3f / 18f),
  MEDIUM(4f / 18f),
  THICK(5f / 18f);

  private final float emFactor;

  SpaceRule(float emFactor) {
    this.emFactor = emFactor;
  }

  /**
   * Width as a fraction of the font size.
   *
   * @return em factor
   */
  public float emFactor() {
    return emFactor;
  }
}
