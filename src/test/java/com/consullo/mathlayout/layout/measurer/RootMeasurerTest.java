package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.Canvas;
import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.AdditionalMatchers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for radical geometry at 20px: rule 1px, hook 6px.
 *
 * @since 1.0
 */
public class RootMeasurerTest {

  private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
  private final RootMeasurer measurer = new RootMeasurer();
  private final RenderContext context = RenderContext.builder().fontSizePx(20f).build();

  @Test
  @DisplayName("Should reserve the hook width and a top gap above the content")
  void measure_SquareRoot_AddsHookAndTopGap() {
    final RootNode root = new RootNode(new TextNode("x", new SourceRange(6, 7)), null, new SourceRange(0, 8));

    final NodeLayout layout = measurer.measure(root, context, engine);

    assertThat(layout.width()).isCloseTo(7f + 10f + 1f + 0.5f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(20f + 3f + 0.5f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(16f + 3f, within(1e-3f));
  }

  @Test
  @DisplayName("Should widen the hook area when the index is wider than the hook")
  void measure_WideIndex_ShiftsContent() {
    final RootNode root = new RootNode(
        new TextNode("x", new SourceRange(9, 10)), new TextNode("33", new SourceRange(6, 8)), new SourceRange(0, 11));

    final NodeLayout layout = measurer.measure(root, context, engine);

    // Index "33" at 12px is 12px wide, content starts at 13
    assertThat(layout.width()).isCloseTo(13f + 10f + 1f + 0.5f, within(1e-3f));
  }

  @Test
  @DisplayName("Should draw the sign as a stroked path plus a vinculum")
  void draw_SquareRoot_PathAndLine() {
    final Canvas canvas = mock(Canvas.class);
    final RootNode root = new RootNode(new TextNode("x", new SourceRange(6, 7)), null, new SourceRange(0, 8));

    measurer.measure(root, context, engine).draw(canvas, 0f, 0f);

    verify(canvas, times(1)).drawGlyphs(any(ShapedText.class), near(7f), near(3f), anyInt());
    verify(canvas).drawLine(near(7f), near(0.5f), anyFloat(), near(0.5f), near(1f), anyInt());
    verify(canvas).drawPath(any(VectorPath.class), eq(0f), eq(0f), near(1f), anyInt());
  }

  private static float near(final float value) {
    return AdditionalMatchers.eq(value, 1e-3f);
  }
}
