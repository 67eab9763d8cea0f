package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.layout.GlyphResolver;
import com.consullo.mathlayout.layout.InkBounds;
import com.consullo.mathlayout.layout.InkBoundsEstimator;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out large operators ({@code \sum}, {@code \int}, {@code \lim}, ...) with their limits.
 *
 * <p>
 * The operator glyph is enlarged according to the math style and its box is tightened to the ink,
 * so limits sit against the visible glyph rather than the font's line box. Limits go either above
 * and below the operator (display placement) or to its right (side placement).
 * </p>
 *
 * <p>
 * In display style an integral can be stretched to match the height of what follows it, see
 * {@link RenderContext#getBigOpHeightHint()}. Half of the stretch (in log terms) comes from a larger
 * font, the rest from a vertical canvas scale, and the weight is lightened as the glyph grows.
 * </p>
 *
 * @since 1.0
 */
public final class BigOperatorMeasurer implements NodeMeasurer<BigOperatorNode> {

  private static final Logger LOGGER = LoggerFactory.getLogger(BigOperatorMeasurer.class);

  private final boolean stretchIntegrals;

  public BigOperatorMeasurer(final boolean stretchIntegrals) {
    this.stretchIntegrals = stretchIntegrals;
  }

  @Override
  public NodeLayout measure(BigOperatorNode node, RenderContext context, MeasureScope scope) {
    final String symbol = GlyphResolver.bigOperatorGlyph(node.name());
    final boolean named = symbol.equals(node.name().trim()) && StringUtils.isAlpha(symbol);
    final boolean integral = node.isIntegral();
    final boolean sideMode = isSideMode(node.limitsMode(), integral, named, context.getMathStyle());

    final float scale;
    if (context.getMathStyle() == MathStyle.DISPLAY) {
      scale = MathConstants.BIG_OP_DISPLAY_SCALE;
    } else if (sideMode) {
      scale = MathConstants.BIG_OP_INLINE_SCALE;
    } else {
      scale = MathConstants.BIG_OP_DEFAULT_SCALE;
    }

    RenderContext opStyle = context.grow(scale).toBuilder()
        .fontFamily(named ? FontFamily.ROMAN : FontFamily.EXTENSION)
        .fontWeight(GlyphResolver.compensatedFontWeight(MathConstants.BIG_OP_SYMBOL_BASE_WEIGHT, scale))
        .italic(false)
        .build();

    final Shaper shaper = scope.shaper();
    ShapedText shaped = shaper.shape(symbol, opStyle.fontSpec());
    InkBounds ink = inkBounds(shaper, shaped, opStyle, named);

    float verticalScale = 1f;
    final Float hint = context.getBigOpHeightHint();
    if (stretchIntegrals && integral && hint != null && context.getMathStyle() == MathStyle.DISPLAY
        && ink.inkHeight() > 0f) {
      final float target = hint * MathConstants.INTEGRAL_HEIGHT_HINT_OVERSHOOT;
      if (target > ink.inkHeight()) {
        final float stretch = target / ink.inkHeight();
        final float fontScaleUp = (float) Math.pow(stretch, MathConstants.INTEGRAL_FONT_SCALE_RATIO);
        verticalScale = stretch / fontScaleUp;
        opStyle = opStyle.grow(fontScaleUp);
        opStyle = opStyle.withFontWeight(stretchedWeight(
            GlyphResolver.compensatedFontWeight(MathConstants.BIG_OP_SYMBOL_BASE_WEIGHT, scale * fontScaleUp),
            verticalScale));
        shaped = shaper.shape(symbol, opStyle.fontSpec());
        ink = inkBounds(shaper, shaped, opStyle, named);
        LOGGER.debug("measure: stretching '{}' by {} (font x{}, canvas x{})",
            node.name(), stretch, fontScaleUp, verticalScale);
      }
    }

    final NodeLayout opLayout = glyphLayout(shaped, ink, verticalScale, context.getColor());
    final float opVisualHeight = named
        ? Math.min(opStyle.getFontSizePx() * MathConstants.BIG_OP_NAMED_VISUAL_HEIGHT, opLayout.height())
        : opLayout.height();

    final RenderContext limitStyle = context.toLimitStyle();
    final NodeLayout superLayout = node.superscript() == null
        ? null
        : scope.measureGroup(List.of(node.superscript()), limitStyle);
    final NodeLayout subLayout = node.subscript() == null
        ? null
        : scope.measureGroup(List.of(node.subscript()), limitStyle);

    final float axisHeight = scope.axisHeight(context);
    if (sideMode) {
      return layoutSide(context, axisHeight, opLayout, superLayout, subLayout,
          integral, named, opVisualHeight, symbol.length());
    }
    return layoutDisplay(context, axisHeight, opLayout, superLayout, subLayout, named);
  }

  static boolean isSideMode(
      BigOperatorNode.LimitsMode mode, boolean integral, boolean named, MathStyle style) {
    switch (mode) {
      case LIMITS:
        return false;
      case NOLIMITS:
        return true;
      default:
        // integrals and named operators keep their scripts beside them unless asked otherwise
        if (integral || named) {
          return true;
        }
        return style != MathStyle.DISPLAY;
    }
  }

  static int stretchedWeight(int currentWeight, float verticalScale) {
    if (verticalScale <= 1f) {
      return currentWeight;
    }
    final int reduction = verticalScale >= 2f
        ? MathConstants.BIG_OP_VERTICAL_SCALE_WEIGHT_REDUCTION
        : (int) ((verticalScale - 1f) * MathConstants.BIG_OP_VERTICAL_SCALE_WEIGHT_REDUCTION);
    return Math.max(MathConstants.BIG_OP_SYMBOL_MIN_WEIGHT,
        Math.min(MathConstants.BIG_OP_SYMBOL_BASE_WEIGHT, currentWeight - reduction));
  }

  private static InkBounds inkBounds(Shaper shaper, ShapedText shaped, RenderContext opStyle, boolean named) {
    final byte[] fontBytes = named ? null : opStyle.getExtensionFontBytes();
    final InkBoundsEstimator.Category category =
        named ? InkBoundsEstimator.Category.TEXT : InkBoundsEstimator.Category.EXTENSION;
    if (fontBytes == null) {
      return InkBoundsEstimator.estimate(shaped, category);
    }
    return InkBoundsEstimator.measurePrecise(shaper, shaped, opStyle.fontSpec(), fontBytes)
        .orElseGet(() -> InkBoundsEstimator.estimate(shaped, category));
  }

  /**
   * Glyph box trimmed to the ink. The glyph is drawn shifted up by the blank space above the ink
   * and, when stretched, scaled vertically about the box top.
   */
  private static NodeLayout glyphLayout(ShapedText shaped, InkBounds ink, float verticalScale, int color) {
    final float rawTopOffset = ink.inkTopOffset();
    final float height = ink.inkHeight() * verticalScale;
    final float baseline = ink.inkBaseline() * verticalScale;
    if (verticalScale == 1f) {
      return new NodeLayout(shaped.width(), height, baseline,
          (canvas, x, y) -> canvas.drawGlyphs(shaped, x, y - rawTopOffset, color));
    }
    return new NodeLayout(shaped.width(), height, baseline, (canvas, x, y) ->
        canvas.withScale(1f, verticalScale, x, y, () -> canvas.drawGlyphs(shaped, x, y - rawTopOffset, color)));
  }

  private NodeLayout layoutSide(
      RenderContext context, float axisHeight, NodeLayout opLayout, NodeLayout superLayout,
      NodeLayout subLayout, boolean integral, boolean named, float opVisualHeight, int symbolLength) {
    final float fontSize = context.getFontSizePx();

    final float opVisualWidth;
    if (integral) {
      opVisualWidth = fontSize * MathConstants.INTEGRAL_VISUAL_WIDTH;
    } else if (named) {
      opVisualWidth = fontSize * symbolLength * MathConstants.NAMED_OP_CHAR_WIDTH;
    } else {
      opVisualWidth = opLayout.width();
    }
    final float opDrawX = integral || named ? Math.max(0f, (opVisualWidth - opLayout.width()) / 2f) : 0f;
    final float opRight = opDrawX == 0f ? opLayout.width() : opVisualWidth;

    // Vertical positions are relative to the baseline, negative is up.
    final float opTop = -axisHeight - opVisualHeight / 2f;
    final float opBottom = opTop + opVisualHeight;
    final float glyphTop = opTop + (opVisualHeight - opLayout.height()) / 2f;

    final float limitSpacing;
    final float limitGap;
    if (integral) {
      limitSpacing = 0f;
      limitGap = 0f;
    } else if (named) {
      limitSpacing = fontSize * MathConstants.NAMED_OP_SIDE_LIMIT_GAP;
      limitGap = fontSize * MathConstants.NAMED_OP_LIMIT_GAP * MathConstants.NAMED_OP_SIDE_LIMIT_GAP_FACTOR;
    } else {
      limitSpacing = context.dp(MathConstants.SCRIPT_KERN_DP);
      limitGap = fontSize * MathConstants.SYMBOL_OP_LIMIT_GAP;
    }
    final float superX = opRight + limitSpacing;
    final float subX = integral ? superX - fontSize * MathConstants.INTEGRAL_SUBSCRIPT_INSET : superX;

    float top = opTop;
    float superTop = 0f;
    if (superLayout != null) {
      superTop = integral ? glyphTop : opTop - superLayout.height() - limitGap;
      top = superTop;
    }
    float bottom = opBottom;
    float subTop = 0f;
    if (subLayout != null) {
      subTop = integral
          ? glyphTop + opLayout.height() - subLayout.baseline() * MathConstants.INTEGRAL_SUBSCRIPT_OVERLAP
          : opBottom + limitGap;
      bottom = subTop + subLayout.height();
    }
    final float baseline = -top;
    final float superRight = superX + (superLayout == null ? 0f : superLayout.width());
    final float subRight = subX + (subLayout == null ? 0f : subLayout.width());
    final float width = Math.max(opRight * MathConstants.BIG_OP_WIDTH_OVERFLOW_FACTOR, Math.max(superRight, subRight));
    final float superY = superTop;
    final float subY = subTop;

    return new NodeLayout(width, bottom - top, baseline, (canvas, x, y) -> {
      opLayout.draw(canvas, x + opDrawX, y + baseline + glyphTop);
      if (superLayout != null) {
        superLayout.draw(canvas, x + superX, y + baseline + superY);
      }
      if (subLayout != null) {
        subLayout.draw(canvas, x + subX, y + baseline + subY);
      }
    });
  }

  private NodeLayout layoutDisplay(
      RenderContext context, float axisHeight, NodeLayout opLayout, NodeLayout superLayout,
      NodeLayout subLayout, boolean named) {
    final float fontSize = context.getFontSizePx();
    final float spacing = fontSize * (named ? MathConstants.NAMED_OP_LIMIT_GAP : MathConstants.SYMBOL_OP_LIMIT_GAP);
    final float width = Math.max(opLayout.width(), Math.max(
        superLayout == null ? 0f : superLayout.width(),
        subLayout == null ? 0f : subLayout.width()));

    // The upper limit's descent is left out so it sits close to the ink.
    final float opY = (superLayout == null ? 0f : superLayout.baseline()) + spacing;
    final float subY = opY + opLayout.height() + spacing;
    final float height = subY + (subLayout == null ? 0f : subLayout.height());
    final float baseline = opY + opLayout.height() / 2f + axisHeight;

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      opLayout.draw(canvas, x + (width - opLayout.width()) / 2f, y + opY);
      if (superLayout != null) {
        superLayout.draw(canvas, x + (width - superLayout.width()) / 2f, y);
      }
      if (subLayout != null) {
        subLayout.draw(canvas, x + (width - subLayout.width()) / 2f, y + subY);
      }
    });
  }
}
