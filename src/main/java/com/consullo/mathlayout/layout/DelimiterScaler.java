package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.Shaper;

/**
 * Shapes delimiter glyphs stretched to a target height.
 *
 * <p>
 * The glyph is re-shaped at a font size scaled so its line box matches the target. Large scales
 * thicken the strokes, so beyond 1.5x the glyph is also compressed horizontally by
 * {@code 1/sqrt(scale)}, capped at 1.6.
 * </p>
 *
 * @since 1.0
 */
public final class DelimiterScaler {

  private DelimiterScaler() {
  }

  /**
   * Delimiter glyph at the context's own size.
   *
   * @param delimiter delimiter command or character
   * @param context style context
   * @param shaper shaper
   * @return glyph layout
   */
  public static NodeLayout measure(final String delimiter, final RenderContext context, final Shaper shaper) {
    return GlyphLayouts.shape(GlyphResolver.delimiterGlyph(delimiter), delimiterContext(context, 1f), shaper);
  }

  /**
   * Delimiter glyph stretched to {@code targetHeight}.
   *
   * @param delimiter delimiter command or character
   * @param context style context
   * @param shaper shaper
   * @param targetHeight desired height in pixels
   * @return scaled glyph layout
   */
  public static NodeLayout measureScaled(
      final String delimiter, final RenderContext context, final Shaper shaper, final float targetHeight) {
    final NodeLayout base = measure(delimiter, context, shaper);
    if (base.height() <= 0f || targetHeight <= 0f) {
      return base;
    }
    final float scale = targetHeight / base.height();
    final RenderContext scaledContext = delimiterContext(context, scale).grow(scale);
    final NodeLayout scaled = GlyphLayouts.shape(GlyphResolver.delimiterGlyph(delimiter), scaledContext, shaper);
    if (scale <= MathConstants.DELIMITER_COMPRESS_THRESHOLD) {
      return scaled;
    }
    final float scaleX = 1f / clamp((float) Math.sqrt(scale), 1f, MathConstants.DELIMITER_MAX_COMPRESSION);
    final float width = scaled.width() * scaleX;
    return new NodeLayout(width, scaled.height(), scaled.baseline(), (canvas, x, y) -> {
      final float centerX = x + width / 2f;
      canvas.withScale(scaleX, 1f, centerX, y, () -> scaled.draw(canvas, centerX - scaled.width() / 2f, y));
    });
  }

  private static RenderContext delimiterContext(RenderContext context, float scale) {
    return context.toBuilder()
        .fontFamily(FontFamily.SYMBOL)
        .italic(false)
        .fontWeight(GlyphResolver.compensatedFontWeight(MathConstants.BIG_OP_SYMBOL_BASE_WEIGHT, scale))
        .build();
  }

  private static float clamp(float value, float min, float max) {
    return Math.max(min, Math.min(max, value));
  }
}
