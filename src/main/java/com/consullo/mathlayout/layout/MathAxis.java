package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the math axis, the line fraction bars and binary operators are centred on.
 *
 * <p>
 * The axis is taken from the centre of a shaped minus sign. Fonts with odd metrics can put that
 * centre in a silly place, so the result is only trusted inside 10%..50% of the font size and
 * replaced by 25% of the font size otherwise.
 * </p>
 *
 * @since 1.0
 */
public final class MathAxis {

  private static final Logger LOGGER = LoggerFactory.getLogger(MathAxis.class);

  private MathAxis() {
  }

  /**
   * Axis height above the baseline, in pixels.
   *
   * @param context current style
   * @param shaper text shaper
   * @return axis height
   */
  public static float axisHeight(final RenderContext context, final Shaper shaper) {
    final float fontSize = context.getFontSizePx();
    final ShapedText minus = shaper.shape("-", context.fontSpec());
    final float axis = minus.baseline() - minus.height() / 2f;
    if (axis < fontSize * MathConstants.MATH_AXIS_MIN_RATIO || axis > fontSize * MathConstants.MATH_AXIS_MAX_RATIO) {
      LOGGER.debug("axisHeight: measured {} outside sane band for size {}, using fallback", axis, fontSize);
      return fontSize * MathConstants.MATH_AXIS_HEIGHT_RATIO;
    }
    return axis;
  }
}
