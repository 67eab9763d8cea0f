package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;
import java.util.List;

/**
 * Lays out accents and wide decorations.
 *
 * <p>
 * Simple accents ({@code \hat}, {@code \vec}, ...) are small glyphs pulled down towards the
 * content by a per-accent offset and nudged right to follow italic slant. Wide accents are vector
 * strokes stretched to the content width. {@code \cancel} strikes through its content and keeps
 * the content's box.
 * </p>
 *
 * @since 1.0
 */
public final class AccentMeasurer implements NodeMeasurer<AccentNode> {

  @Override
  public NodeLayout measure(AccentNode node, RenderContext context, MeasureScope scope) {
    final NodeLayout content = scope.measureGroup(List.of(node.content()), context);
    if (node.kind() == AccentNode.Kind.CANCEL) {
      return measureCancel(content, context);
    }
    if (node.kind().isWide()) {
      return measureWide(node.kind(), content, context);
    }
    return measureSimple(node.kind(), content, context, scope);
  }

  static String accentChar(AccentNode.Kind kind) {
    switch (kind) {
      case HAT:
        return "^";
      case TILDE:
        return "~";
      case BAR:
        return "¯";
      case VEC:
        return "→";
      case DOT:
        return "˙";
      case DDOT:
        return "¨";
      default:
        return "";
    }
  }

  /** Accent height and downward offset, as ratios of the font size. */
  private static float[] heightAndOffset(AccentNode.Kind kind) {
    switch (kind) {
      case HAT:
        return new float[] {MathConstants.ACCENT_HAT_HEIGHT, MathConstants.ACCENT_HAT_OFFSET};
      case TILDE:
        return new float[] {MathConstants.ACCENT_TILDE_HEIGHT, MathConstants.ACCENT_TILDE_OFFSET};
      case BAR:
        return new float[] {MathConstants.ACCENT_BAR_HEIGHT, MathConstants.ACCENT_BAR_OFFSET};
      case VEC:
        return new float[] {MathConstants.ACCENT_VEC_HEIGHT, MathConstants.ACCENT_VEC_OFFSET};
      case DOT:
        return new float[] {MathConstants.ACCENT_DOT_HEIGHT, MathConstants.ACCENT_DOT_OFFSET};
      case DDOT:
        return new float[] {MathConstants.ACCENT_DDOT_HEIGHT, MathConstants.ACCENT_DDOT_OFFSET};
      default:
        return new float[] {MathConstants.ACCENT_DEFAULT_HEIGHT, MathConstants.ACCENT_DEFAULT_OFFSET};
    }
  }

  private NodeLayout measureSimple(
      AccentNode.Kind kind, NodeLayout content, RenderContext context, MeasureScope scope) {
    final RenderContext accentStyle = context.shrink(MathConstants.ACCENT_SCALE);
    final ShapedText glyph = scope.shaper().shape(accentChar(kind), accentStyle.fontSpec());
    final float fontSize = context.getFontSizePx();
    final float[] params = heightAndOffset(kind);

    final float accentHeight = fontSize * params[0];
    final float downOffset = Math.min(accentHeight * MathConstants.ACCENT_MAX_OVERLAP, fontSize * params[1]);
    final float width = Math.max(content.width(), glyph.width());
    final float height = content.height() + accentHeight - downOffset;
    final float baseline = content.baseline() + accentHeight - downOffset;
    final float italicCorrection = fontSize * MathConstants.ACCENT_ITALIC_CORRECTION;
    final int color = context.getColor();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      final float centerX = x + width / 2f;
      canvas.drawGlyphs(glyph, centerX - glyph.width() / 2f + italicCorrection, y + downOffset, color);
      content.draw(canvas, centerX - content.width() / 2f, y + accentHeight - downOffset);
    });
  }

  private NodeLayout measureCancel(NodeLayout content, RenderContext context) {
    final float stroke = context.dp(MathConstants.WIDE_ACCENT_STROKE_DP);
    final int color = context.getColor();
    return new NodeLayout(content.width(), content.height(), content.baseline(), (canvas, x, y) -> {
      content.draw(canvas, x, y);
      canvas.drawLine(x, y + content.height(), x + content.width(), y, stroke, color);
    });
  }

  private NodeLayout measureWide(AccentNode.Kind kind, NodeLayout content, RenderContext context) {
    final float fontSize = context.getFontSizePx();
    final boolean under = kind.isUnder();
    final boolean brace = kind == AccentNode.Kind.OVERBRACE || kind == AccentNode.Kind.UNDERBRACE;
    final boolean arrow = kind == AccentNode.Kind.OVERRIGHTARROW || kind == AccentNode.Kind.OVERLEFTARROW;
    final boolean line = kind == AccentNode.Kind.OVERLINE || kind == AccentNode.Kind.UNDERLINE;

    final float stroke = context.dp(brace ? MathConstants.WIDE_ACCENT_BRACE_STROKE_DP : MathConstants.WIDE_ACCENT_STROKE_DP);
    final float strokeHalf = stroke / 2f;
    final float accentHeight;
    if (line) {
      accentHeight = context.dp(MathConstants.WIDE_ACCENT_LINE_HEIGHT_DP);
    } else if (arrow) {
      accentHeight = fontSize * MathConstants.WIDE_ACCENT_ARROW_HEIGHT;
    } else {
      accentHeight = fontSize * MathConstants.WIDE_ACCENT_DEFAULT_HEIGHT;
    }
    final float gap = fontSize * (arrow ? MathConstants.WIDE_ACCENT_ARROW_GAP : MathConstants.WIDE_ACCENT_DEFAULT_GAP);

    final float width = content.width();
    final float height = content.height() + accentHeight + gap + strokeHalf;
    final float baseline = content.baseline() + (under ? 0f : accentHeight + gap);
    final VectorPath path = accentPath(kind, width, accentHeight, context);
    final int color = context.getColor();

    return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
      final float accentY = under ? y + content.height() + gap : y;
      final float contentY = under ? y : y + accentHeight + gap;
      if (line) {
        canvas.drawLine(x, accentY + strokeHalf, x + width, accentY + strokeHalf, stroke, color);
      } else if (arrow) {
        final float midY = accentY + accentHeight / 2f;
        canvas.drawLine(x, midY, x + width, midY, stroke, color);
        canvas.drawPath(path, x, accentY, 0f, color);
      } else {
        canvas.drawPath(path, x, accentY, stroke, color);
      }
      content.draw(canvas, x, contentY);
    });
  }

  static VectorPath accentPath(AccentNode.Kind kind, float width, float accentHeight, RenderContext context) {
    final float centerX = width / 2f;
    switch (kind) {
      case OVERBRACE:
        return bracePath(width, accentHeight, false);
      case UNDERBRACE:
        return bracePath(width, accentHeight, true);
      case WIDEHAT:
        return VectorPath.builder()
            .moveTo(0f, accentHeight)
            .lineTo(centerX, 0f)
            .lineTo(width, accentHeight)
            .build();
      case OVERRIGHTARROW: {
        final float head = context.dp(MathConstants.WIDE_ACCENT_ARROW_HEAD_DP);
        final float midY = accentHeight / 2f;
        return VectorPath.builder()
            .moveTo(width, midY)
            .lineTo(width - head, midY - head / 2f)
            .lineTo(width - head, midY + head / 2f)
            .close()
            .build();
      }
      case OVERLEFTARROW: {
        final float head = context.dp(MathConstants.WIDE_ACCENT_ARROW_HEAD_DP);
        final float midY = accentHeight / 2f;
        return VectorPath.builder()
            .moveTo(0f, midY)
            .lineTo(head, midY - head / 2f)
            .lineTo(head, midY + head / 2f)
            .close()
            .build();
      }
      default:
        return VectorPath.builder().build();
    }
  }

  /**
   * Horizontal curly brace spanning {@code width}, tip pointing up for an overbrace and down for
   * an underbrace. The ends curl towards the content.
   */
  private static VectorPath bracePath(float width, float accentHeight, boolean under) {
    final float centerX = width / 2f;
    final float tipHeight = accentHeight * 0.25f;
    final float curveWidth = Math.min(width / 2f, accentHeight);
    final float endY = under ? 0f : accentHeight;
    final float tipY = under ? accentHeight : 0f;
    final float shoulderY = under ? accentHeight - tipHeight : tipHeight;
    final float endControlY = endY + (shoulderY - endY) * 0.6f;
    final float tipControlY = shoulderY + (tipY - shoulderY) * 0.6f;

    return VectorPath.builder()
        .moveTo(0f, endY)
        .cubicTo(0f, endControlY, curveWidth * 0.4f, shoulderY, curveWidth, shoulderY)
        .lineTo(centerX - curveWidth, shoulderY)
        .cubicTo(centerX - curveWidth * 0.4f, shoulderY, centerX, tipControlY, centerX, tipY)
        .cubicTo(centerX, tipControlY, centerX + curveWidth * 0.4f, shoulderY, centerX + curveWidth, shoulderY)
        .lineTo(width - curveWidth, shoulderY)
        .cubicTo(width - curveWidth * 0.4f, shoulderY, width, endControlY, width, endY)
        .build();
  }
}
