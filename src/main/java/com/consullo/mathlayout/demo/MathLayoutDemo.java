package com.consullo.mathlayout.demo;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.awt.AwtCanvas;
import com.consullo.mathlayout.core.awt.AwtShaper;
import com.consullo.mathlayout.core.tree.DocumentNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.editor.CursorCalculator;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutMap;
import com.consullo.mathlayout.layout.MathLayoutFactory;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders {@code \frac{a}{b}+x^{2}} to a PNG and logs where the caret lands for each offset.
 *
 * @since 1.0
 */
public final class MathLayoutDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(MathLayoutDemo.class);

  static final String SOURCE = "\\frac{a}{b}+x^{2}";
  private static final float FONT_SIZE_PX = 48f;
  private static final int PADDING_PX = 16;

  private MathLayoutDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional output file, defaults to {@code math-layout-demo.png}
   * @throws IOException if the image cannot be written
   */
  public static void main(final String[] args) throws IOException {
    final File output = new File(args.length > 0 ? args[0] : "math-layout-demo.png");

    final AwtShaper shaper = new AwtShaper();
    final LayoutEngine engine = MathLayoutFactory.createEngine(shaper);
    final RenderContext context = MathLayoutFactory.createContext(FONT_SIZE_PX, true);
    final LayoutMap layoutMap = new LayoutMap();

    final NodeLayout layout = engine.measure(sampleDocument(), context, layoutMap);
    LOGGER.info("Measured {}: width={}, height={}, baseline={}",
        SOURCE, layout.width(), layout.height(), layout.baseline());

    for (int offset = 0; offset <= SOURCE.length(); offset++) {
      final int current = offset;
      CursorCalculator.calculate(offset, layoutMap, PADDING_PX, PADDING_PX)
          .ifPresent(cursor -> LOGGER.info("offset {} -> caret x={}, y={}, height={}",
              current, cursor.x(), cursor.y(), cursor.height()));
    }

    final int width = (int) Math.ceil(layout.width()) + 2 * PADDING_PX;
    final int height = (int) Math.ceil(layout.height()) + 2 * PADDING_PX;
    final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    final Graphics2D graphics = image.createGraphics();
    try {
      graphics.setColor(Color.WHITE);
      graphics.fillRect(0, 0, width, height);
      layout.draw(new AwtCanvas(graphics, shaper), PADDING_PX, PADDING_PX);
    } finally {
      graphics.dispose();
    }

    try {
      ImageIO.write(image, "png", output);
    } catch (IOException e) {
      LOGGER.error("Failed to write {}", output, e);
      throw e;
    }
    LOGGER.info("Wrote {}x{} image to {}", width, height, output.getAbsolutePath());
  }

  /**
   * Tree for {@link #SOURCE} with source ranges as a parser would assign them.
   *
   * @return document node
   */
  static MathNode sampleDocument() {
    MathNode numerator = new GroupNode(List.of(new TextNode("a", new SourceRange(6, 7))), new SourceRange(5, 8));
    MathNode denominator = new GroupNode(List.of(new TextNode("b", new SourceRange(9, 10))), new SourceRange(8, 11));
    MathNode fraction = new FractionNode(numerator, denominator, new SourceRange(0, 11));
    MathNode plus = new TextNode("+", new SourceRange(11, 12));
    MathNode exponent = new GroupNode(List.of(new TextNode("2", new SourceRange(15, 16))), new SourceRange(14, 17));
    MathNode power = new SuperscriptNode(new TextNode("x", new SourceRange(12, 13)), exponent, new SourceRange(12, 17));
    return new DocumentNode(List.of(fraction, plus, power), new SourceRange(0, SOURCE.length()));
  }
}
