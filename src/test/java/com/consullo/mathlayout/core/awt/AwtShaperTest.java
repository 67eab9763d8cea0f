package com.consullo.mathlayout.core.awt;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.FontSpec;
import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.GraphicsEnvironment;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for the AWT shaper and canvas, run headless.
 *
 * @since 1.0
 */
public class AwtShaperTest {

  private static final FontSpec SERIF_20 = new FontSpec(FontFamily.ROMAN, 20f, 400, false);

  private final AwtShaper shaper = new AwtShaper();

  /** Minimal containers may ship without any fonts; shaping tests are skipped there. */
  private static boolean fontsAvailable() {
    try {
      return GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames().length > 0;
    } catch (RuntimeException | Error e) {
      return false;
    }
  }

  @Test
  @DisplayName("Should shape text with a positive advance and a baseline inside the line box")
  void shape_Text_PositiveMetrics() {
    assumeTrue(fontsAvailable());

    final ShapedText shaped = shaper.shape("x+y", SERIF_20);

    assertThat(shaped.width()).isPositive();
    assertThat(shaped.height()).isPositive();
    assertThat(shaped.baseline()).isBetween(0f, shaped.height());
  }

  @Test
  @DisplayName("Should give empty text no width but a line height")
  void shape_EmptyText_ZeroWidth() {
    assumeTrue(fontsAvailable());

    final ShapedText shaped = shaper.shape("", SERIF_20);

    assertThat(shaped.width()).isZero();
    assertThat(shaped.height()).isPositive();
  }

  @Test
  @DisplayName("Should report no ink bounds without font bytes")
  void glyphBounds_NoBytes_Empty() {
    assertThat(shaper.glyphBounds("x", SERIF_20, null)).isEmpty();
    assertThat(shaper.glyphBounds("", SERIF_20, new byte[] {1})).isEmpty();
  }

  @Test
  @DisplayName("Should report no ink bounds for bytes that are not a font, every time")
  void glyphBounds_GarbageBytes_Empty() {
    final byte[] garbage = {1, 2, 3, 4};

    assertThat(shaper.glyphBounds("x", SERIF_20, garbage)).isEmpty();
    assertThat(shaper.glyphBounds("y", SERIF_20, garbage)).isEmpty();
  }

  @Test
  @DisplayName("Should lay out a display sum with unreadable extension font bytes using estimated ink")
  void measure_GarbageExtensionFont_FallsBackToEstimate() {
    assumeTrue(fontsAvailable());
    final LayoutEngine engine = new LayoutEngine(shaper, LayoutEngineConfig.defaults());
    final BigOperatorNode sum = new BigOperatorNode("sum", null, null,
        BigOperatorNode.LimitsMode.AUTO, new SourceRange(0, 4));
    final RenderContext plain = RenderContext.builder().fontSizePx(20f).mathStyle(MathStyle.DISPLAY).build();
    final RenderContext garbage = plain.toBuilder().extensionFontBytes(new byte[] {1, 2, 3, 4}).build();

    final NodeLayout estimated = engine.measure(sum, plain);
    final NodeLayout fallback = engine.measure(sum, garbage);

    assertThat(fallback.height()).isPositive().isEqualTo(estimated.height());
    assertThat(fallback.width()).isEqualTo(estimated.width());
  }

  @Test
  @DisplayName("Should fill a rectangle when the stroke width is zero")
  void drawRect_ZeroStroke_Filled() {
    final BufferedImage image = new BufferedImage(20, 20, BufferedImage.TYPE_INT_ARGB);
    final Graphics2D graphics = image.createGraphics();
    try {
      new AwtCanvas(graphics, shaper).drawRect(5f, 5f, 10f, 10f, 0f, Color.RED.getRGB());
    } finally {
      graphics.dispose();
    }

    assertThat(image.getRGB(10, 10)).isEqualTo(Color.RED.getRGB());
    assertThat(image.getRGB(1, 1)).isZero();
  }

  @Test
  @DisplayName("Should convert a vector path into an AWT shape with the same bounds")
  void toPath2D_Triangle_SameBounds() {
    final Path2D.Float shape = AwtCanvas.toPath2D(VectorPath.builder()
        .moveTo(0f, 0f)
        .lineTo(10f, 5f)
        .lineTo(0f, 10f)
        .close()
        .build());

    assertThat(shape.getBounds2D()).isEqualTo(new Rectangle2D.Float(0f, 0f, 10f, 10f));
  }
}
