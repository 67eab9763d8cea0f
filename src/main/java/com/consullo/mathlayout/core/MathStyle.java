package com.consullo.mathlayout.core;

/**
 * TeX math style levels with their size factors relative to the base font size.
 *
 * @since 1.0
 */
public enum MathStyle {
  DISPLAY(1.0f),
  TEXT(1.0f),
  SCRIPT(0.7f),
  SCRIPT_SCRIPT(0.5f);

  private final float scale;

  MathStyle(float scale) {
    this.scale = scale;
  }

  public float scale() {
    return scale;
  }

  public boolean isScript() {
    return this == SCRIPT || this == SCRIPT_SCRIPT;
  }

  /**
   * Level used for super- and subscripts.
   *
   * @return script level
   */
  public MathStyle toScript() {
    switch (this) {
      case DISPLAY:
      case TEXT:
        return SCRIPT;
      default:
        return SCRIPT_SCRIPT;
    }
  }

  /**
   * Level used for numerators and denominators: always one step down.
   *
   * @return fraction child level
   */
  public MathStyle toFractionChild() {
    switch (this) {
      case DISPLAY:
        return TEXT;
      case TEXT:
        return SCRIPT;
      default:
        return SCRIPT_SCRIPT;
    }
  }
}
