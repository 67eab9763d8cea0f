package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.awt.AwtShaper;

/**
 * Factory for layout engines and style contexts with sensible defaults.
 *
 * <p>
 * This class centralizes the decision-making around:
 * <ul>
 * <li>the text backend (AWT, headless-safe)</li>
 * <li>engine tuning ({@link LayoutEngineConfig#defaults()})</li>
 * <li>the starting style of a formula (inline or display)</li>
 * </ul>
 * </p>
 */
public final class MathLayoutFactory {

  private MathLayoutFactory() {
  }

  /**
   * Engine over a fresh {@link AwtShaper} with default configuration.
   *
   * @return layout engine
   */
  public static LayoutEngine createDefaultEngine() {
    return new LayoutEngine(new AwtShaper(), LayoutEngineConfig.defaults());
  }

  /**
   * Engine over the given shaper with default configuration.
   *
   * @param shaper AWT shaper, also needed later by the matching canvas
   * @return layout engine
   */
  public static LayoutEngine createEngine(AwtShaper shaper) {
    if (shaper == null) {
      throw new IllegalArgumentException("shaper must not be null.");
    }
    return new LayoutEngine(shaper, LayoutEngineConfig.defaults());
  }

  /**
   * Starting context for a formula.
   *
   * @param fontSizePx base font size in pixels
   * @param display true for display math ({@code $$...$$}), false for inline
   * @return style context
   */
  public static RenderContext createContext(float fontSizePx, boolean display) {
    if (!(fontSizePx > 0f)) {
      throw new IllegalArgumentException("fontSizePx must be positive.");
    }
    return RenderContext.builder()
        .fontSizePx(fontSizePx)
        .mathStyle(display ? MathStyle.DISPLAY : MathStyle.TEXT)
        .build();
  }
}
