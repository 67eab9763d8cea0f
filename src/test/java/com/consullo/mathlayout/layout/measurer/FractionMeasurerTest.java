package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.Canvas;
import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for fraction geometry at 20px with fixed metrics (axis height 6px).
 *
 * @since 1.0
 */
@ExtendWith(MockitoExtension.class)
public class FractionMeasurerTest {

  private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
  private final FractionMeasurer measurer = new FractionMeasurer();
  private final FractionNode fraction = new FractionNode(
      new TextNode("a", new SourceRange(6, 7)), new TextNode("b", new SourceRange(9, 10)), new SourceRange(0, 11));

  @Mock
  private Canvas canvas;

  @Captor
  private ArgumentCaptor<Float> floats;

  private static RenderContext context(final MathStyle style) {
    return RenderContext.builder().fontSizePx(20f).mathStyle(style).build();
  }

  @Test
  @DisplayName("Should stack numerator and denominator around a rule on the axis in text style")
  void measure_TextStyle_ChildrenAtScriptSize() {
    final NodeLayout layout = measurer.measure(fraction, context(MathStyle.TEXT), engine);

    // Children at 20 * 0.7 * 0.9 = 12.6px
    assertThat(layout.width()).isCloseTo(12.6f * 0.5f + 3f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(12.6f + 3f + 1f + 3f + 12.6f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(12.6f + 3f + 0.5f + 6f, within(1e-3f));
  }

  @Test
  @DisplayName("Should use text-size children in display style")
  void measure_DisplayStyle_ChildrenAtTextSize() {
    final NodeLayout layout = measurer.measure(fraction, context(MathStyle.DISPLAY), engine);

    assertThat(layout.width()).isCloseTo(9f + 3f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(43f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(27.5f, within(1e-3f));
  }

  @Test
  @DisplayName("Should draw both children and an inset rule")
  void draw_Fraction_PaintsRuleAndChildren() {
    final NodeLayout layout = measurer.measure(fraction, context(MathStyle.DISPLAY), engine);

    layout.draw(canvas, 0f, 0f);

    verify(canvas, times(2)).drawGlyphs(any(ShapedText.class), anyFloat(), anyFloat(), anyInt());
    verify(canvas).drawLine(floats.capture(), floats.capture(), floats.capture(), floats.capture(),
        floats.capture(), anyInt());
    assertThat(floats.getAllValues().get(0)).isCloseTo(1.5f, within(1e-3f));
    assertThat(floats.getAllValues().get(1)).isCloseTo(21.5f, within(1e-3f));
    assertThat(floats.getAllValues().get(2)).isCloseTo(10.5f, within(1e-3f));
    assertThat(floats.getAllValues().get(4)).isCloseTo(1f, within(1e-3f));
  }
}
