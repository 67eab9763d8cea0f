package com.consullo.mathlayout.core.awt;

import com.consullo.mathlayout.core.Canvas;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.VectorPath;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.geom.Line2D;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;

/**
 * {@link Canvas} drawing onto a {@link Graphics2D}, e.g. one obtained from a
 * {@link java.awt.image.BufferedImage}.
 *
 * <p>
 * Shaped runs are repainted with the font the {@link AwtShaper} resolves for them, so canvas and
 * shaper must share the same family mapping.
 * </p>
 *
 * @since 1.0
 */
public final class AwtCanvas implements Canvas {

  private final Graphics2D graphics;
  private final AwtShaper shaper;

  public AwtCanvas(Graphics2D graphics, AwtShaper shaper) {
    if (graphics == null || shaper == null) {
      throw new IllegalArgumentException("graphics/shaper must not be null.");
    }
    this.graphics = graphics;
    this.shaper = shaper;
    graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
    graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
    graphics.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
  }

  @Override
  public void drawGlyphs(ShapedText text, float x, float y, int argb) {
    if (text.text().isEmpty()) {
      return;
    }
    graphics.setColor(new Color(argb, true));
    graphics.setFont(shaper.toAwtFont(text.font()));
    graphics.drawString(text.text(), x, y + text.baseline());
  }

  @Override
  public void drawLine(float x1, float y1, float x2, float y2, float strokeWidth, int argb) {
    graphics.setColor(new Color(argb, true));
    graphics.setStroke(new BasicStroke(strokeWidth));
    graphics.draw(new Line2D.Float(x1, y1, x2, y2));
  }

  @Override
  public void drawPath(VectorPath path, float x, float y, float strokeWidth, int argb) {
    Path2D.Float shape = toPath2D(path);
    shape.transform(AffineTransform.getTranslateInstance(x, y));
    graphics.setColor(new Color(argb, true));
    if (strokeWidth <= 0f) {
      graphics.fill(shape);
    } else {
      graphics.setStroke(new BasicStroke(strokeWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
      graphics.draw(shape);
    }
  }

  @Override
  public void drawRect(float x, float y, float width, float height, float strokeWidth, int argb) {
    Rectangle2D.Float rect = new Rectangle2D.Float(x, y, width, height);
    graphics.setColor(new Color(argb, true));
    if (strokeWidth <= 0f) {
      graphics.fill(rect);
    } else {
      graphics.setStroke(new BasicStroke(strokeWidth));
      graphics.draw(rect);
    }
  }

  @Override
  public void withScale(float scaleX, float scaleY, float pivotX, float pivotY, Runnable body) {
    AffineTransform saved = graphics.getTransform();
    try {
      graphics.translate(pivotX, pivotY);
      graphics.scale(scaleX, scaleY);
      graphics.translate(-pivotX, -pivotY);
      body.run();
    } finally {
      graphics.setTransform(saved);
    }
  }

  static Path2D.Float toPath2D(VectorPath path) {
    Path2D.Float shape = new Path2D.Float();
    for (VectorPath.Segment segment : path.getSegments()) {
      float[] p = segment.points();
      switch (segment.verb()) {
        case MOVE_TO:
          shape.moveTo(p[0], p[1]);
          break;
        case LINE_TO:
          shape.lineTo(p[0], p[1]);
          break;
        case CUBIC_TO:
          shape.curveTo(p[0], p[1], p[2], p[3], p[4], p[5]);
          break;
        case CLOSE:
          shape.closePath();
          break;
        default:
          throw new IllegalStateException("Unknown verb: " + segment.verb());
      }
    }
    return shape;
  }
}
