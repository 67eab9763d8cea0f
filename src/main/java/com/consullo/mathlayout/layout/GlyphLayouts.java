package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;

/**
 * Wraps shaped text into a {@link NodeLayout} that paints it.
 *
 * @since 1.0
 */
public final class GlyphLayouts {

  private GlyphLayouts() {
  }

  public static NodeLayout of(final ShapedText shaped, final int argb) {
    return new NodeLayout(shaped.width(), shaped.height(), shaped.baseline(),
        (canvas, x, y) -> canvas.drawGlyphs(shaped, x, y, argb));
  }

  /**
   * Shape {@code text} with the context's font and color.
   *
   * @param text text
   * @param context style context
   * @param shaper shaper
   * @return text layout
   */
  public static NodeLayout shape(final String text, final RenderContext context, final Shaper shaper) {
    return of(shaper.shape(text, context.fontSpec()), context.getColor());
  }
}
