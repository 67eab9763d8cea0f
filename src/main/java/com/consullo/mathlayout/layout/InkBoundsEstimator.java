package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.FontSpec;
import com.consullo.mathlayout.core.GlyphBounds;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tightens line-box metrics of large glyphs to their ink.
 *
 * <p>
 * The precise path asks the {@link Shaper} for glyph bounds from raw font bytes. Without bytes
 * the bounds are estimated from the baseline: extension fonts carry a lot of empty descent, text
 * fonts are taken as-is. The estimate coefficients are empirical and best-effort.
 * </p>
 *
 * @since 1.0
 */
public final class InkBoundsEstimator {

  private static final Logger LOGGER = LoggerFactory.getLogger(InkBoundsEstimator.class);

  private static final float EXTENSION_INK_HEIGHT_RATIO = 0.92f;
  private static final float EXTENSION_INK_BOTTOM_RATIO = 1.02f;

  /**
   * How much blank space a font's line box is expected to carry around the ink.
   */
  public enum Category {
    /** Large operators and delimiters, with generous descent. */
    EXTENSION,
    /** Ordinary text, line box close to the ink. */
    TEXT
  }

  private InkBoundsEstimator() {
  }

  /**
   * Exact ink bounds via the shaper, when it can read the font bytes.
   *
   * @param shaper shaper
   * @param shaped shaped run whose baseline anchors the result
   * @param font font the run was shaped with
   * @param fontBytes raw font file
   * @return bounds, or empty when the shaper cannot measure them
   */
  public static Optional<InkBounds> measurePrecise(
      final Shaper shaper, final ShapedText shaped, final FontSpec font, final byte[] fontBytes) {
    Optional<GlyphBounds> bounds = shaper.glyphBounds(shaped.text(), font, fontBytes);
    if (bounds.isEmpty()) {
      LOGGER.debug("measurePrecise: no glyph bounds for '{}', falling back to estimate", shaped.text());
      return Optional.empty();
    }
    GlyphBounds glyph = bounds.get();
    float inkTopOffset = Math.max(0f, shaped.baseline() - glyph.ascent());
    return Optional.of(new InkBounds(glyph.inkHeight(), inkTopOffset, glyph.ascent()));
  }

  /**
   * Heuristic ink bounds from ordinary metrics.
   *
   * @param shaped shaped run
   * @param category font category
   * @return estimated bounds
   */
  public static InkBounds estimate(final ShapedText shaped, final Category category) {
    final float height = shaped.height();
    final float baseline = shaped.baseline();
    if (category == Category.TEXT) {
      return new InkBounds(height, 0f, baseline);
    }
    float inkBottom = Math.min(baseline * EXTENSION_INK_BOTTOM_RATIO, height);
    float inkHeight = Math.min(baseline * EXTENSION_INK_HEIGHT_RATIO, inkBottom);
    float inkTopOffset = inkBottom - inkHeight;
    return new InkBounds(inkHeight, inkTopOffset, baseline - inkTopOffset);
  }
}
