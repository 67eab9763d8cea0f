package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.layout.MathConstants;

/**
 * Baseline shifts and kern shared by every measurer that attaches scripts.
 */
final class ScriptShifts {

  private ScriptShifts() {
  }

  /** Script baseline relative to the base baseline; negative is up. */
  static float relativeY(final boolean upper, final RenderContext context) {
    final float fontSize = context.getFontSizePx();
    return upper ? -fontSize * MathConstants.SUPERSCRIPT_SHIFT : fontSize * MathConstants.SUBSCRIPT_SHIFT;
  }

  static float kern(final RenderContext context) {
    return context.dp(MathConstants.SCRIPT_KERN_DP);
  }
}
