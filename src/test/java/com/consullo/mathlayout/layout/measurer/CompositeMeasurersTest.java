package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.Canvas;
import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.VectorPath;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.core.tree.BoxedNode;
import com.consullo.mathlayout.core.tree.ExtensibleArrowNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.PhantomNode;
import com.consullo.mathlayout.core.tree.SideSetNode;
import com.consullo.mathlayout.core.tree.SmashNode;
import com.consullo.mathlayout.core.tree.StackNode;
import com.consullo.mathlayout.core.tree.TensorNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for binomials, stacks, extensible arrows, box effects and indexed scripts at 20px.
 *
 * @since 1.0
 */
public class CompositeMeasurersTest {

  private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
  private final RenderContext context = RenderContext.builder().fontSizePx(20f).build();

  private static MathNode text(final String content, final int start) {
    return new TextNode(content, new SourceRange(start, start + content.length()));
  }

  @Nested
  @DisplayName("Binomial")
  class Binomial {

    @Test
    @DisplayName("Should stack shrunken children between padded parentheses")
    void measure_Binomial_CentredOnAxis() {
      final NodeLayout layout = new BinomialMeasurer().measure(
          new BinomialNode(text("a", 6), text("b", 9), new SourceRange(0, 11)), context, engine);

      // Children at 18px, gap 4, padding 3, axis 6
      assertThat(layout.height()).isCloseTo(46f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(18f + 2f + 3f + 6f, within(1e-3f));
    }
  }

  @Nested
  @DisplayName("Stack")
  class Stack {

    @Test
    @DisplayName("Should place a shrunken annotation above the base")
    void measure_Overset_AnnotationAbove() {
      final NodeLayout layout = new StackMeasurer().measure(
          new StackNode(text("x", 12), text("a", 9), null, new SourceRange(0, 14)), context, engine);

      assertThat(layout.width()).isCloseTo(10f, within(1e-3f));
      assertThat(layout.height()).isCloseTo(14f + 1.6f + 20f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(15.6f + 16f, within(1e-3f));
    }

    @Test
    @DisplayName("Should keep the base baseline when the annotation is below")
    void measure_Underset_BaselineFromBase() {
      final NodeLayout layout = new StackMeasurer().measure(
          new StackNode(text("x", 12), null, text("abc", 9), new SourceRange(0, 14)), context, engine);

      assertThat(layout.width()).isCloseTo(21f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(16f, within(1e-3f));
    }
  }

  @Nested
  @DisplayName("Extensible arrow")
  class Arrow {

    @Test
    @DisplayName("Should enforce the minimum arrow length and centre the label")
    void measure_ShortLabel_MinimumLength() {
      final NodeLayout layout = new ExtensibleArrowMeasurer().measure(
          new ExtensibleArrowNode(text("f", 13), null, ExtensibleArrowNode.Direction.RIGHT, new SourceRange(0, 15)),
          context, engine);

      assertThat(layout.width()).isCloseTo(38f, within(1e-3f));
      assertThat(layout.height()).isCloseTo(18f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(17f, within(1e-3f));
    }

    @Test
    @DisplayName("Should draw a head at each end of a two-way arrow")
    void draw_BothDirections_TwoHeads() {
      final Canvas canvas = mock(Canvas.class);

      new ExtensibleArrowMeasurer().measure(
          new ExtensibleArrowNode(text("f", 13), text("g", 16), ExtensibleArrowNode.Direction.BOTH,
              new SourceRange(0, 18)), context, engine).draw(canvas, 0f, 0f);

      verify(canvas, times(2)).drawPath(any(VectorPath.class), eq(0f), eq(0f), eq(0f), anyInt());
      verify(canvas, times(2)).drawGlyphs(any(ShapedText.class), anyFloat(), anyFloat(), anyInt());
    }
  }

  @Nested
  @DisplayName("Special effects")
  class Effects {

    private final SpecialEffectMeasurer measurer = new SpecialEffectMeasurer();
    private final List<MathNode> content = List.of(text("x", 7));

    @Test
    @DisplayName("Should pad a boxed formula and frame it")
    void measure_Boxed_PaddedFrame() {
      final Canvas canvas = mock(Canvas.class);

      final NodeLayout layout = measurer.measure(new BoxedNode(content, new SourceRange(0, 9)), context, engine);
      layout.draw(canvas, 0f, 0f);

      assertThat(layout.width()).isCloseTo(16f, within(1e-3f));
      assertThat(layout.height()).isCloseTo(26f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(19f, within(1e-3f));
      verify(canvas).drawRect(eq(0f), eq(0f), anyFloat(), anyFloat(), eq(1f), anyInt());
    }

    @Test
    @DisplayName("Should keep only the requested dimensions of a phantom and paint nothing")
    void measure_Phantoms_KeepSelectedDimensions() {
      final Canvas canvas = mock(Canvas.class);

      final NodeLayout full = measurer.measure(
          new PhantomNode(content, PhantomNode.Kind.PHANTOM, new SourceRange(0, 10)), context, engine);
      final NodeLayout horizontal = measurer.measure(
          new PhantomNode(content, PhantomNode.Kind.HPHANTOM, new SourceRange(0, 10)), context, engine);
      final NodeLayout vertical = measurer.measure(
          new PhantomNode(content, PhantomNode.Kind.VPHANTOM, new SourceRange(0, 10)), context, engine);
      full.draw(canvas, 0f, 0f);

      assertThat(full.width()).isEqualTo(10f);
      assertThat(full.height()).isEqualTo(20f);
      assertThat(horizontal.width()).isEqualTo(10f);
      assertThat(horizontal.height()).isZero();
      assertThat(vertical.width()).isZero();
      assertThat(vertical.height()).isEqualTo(20f);
      assertThat(vertical.baseline()).isEqualTo(16f);
      verifyNoInteractions(canvas);
    }

    @Test
    @DisplayName("Should drop the height of smashed content but still draw it")
    void measure_Smash_ZeroHeight() {
      final Canvas canvas = mock(Canvas.class);

      final NodeLayout layout = measurer.measure(new SmashNode(content, new SourceRange(0, 9)), context, engine);
      layout.draw(canvas, 0f, 30f);

      assertThat(layout.width()).isEqualTo(10f);
      assertThat(layout.height()).isZero();
      verify(canvas).drawGlyphs(any(ShapedText.class), eq(0f), eq(14f), anyInt());
    }
  }

  @Nested
  @DisplayName("Indexed scripts")
  class Indexed {

    private final IndexedScriptMeasurer measurer = new IndexedScriptMeasurer();

    @Test
    @DisplayName("Should give every tensor index its own column")
    void measure_Tensor_StaggeredColumns() {
      final TensorNode tensor = new TensorNode(text("T", 8), List.of(
          new TensorNode.Index(true, text("a", 11)),
          new TensorNode.Index(false, text("b", 13))), new SourceRange(0, 15));

      final NodeLayout layout = measurer.measure(tensor, context, engine);

      assertThat(layout.width()).isCloseTo(25f, within(1e-3f));
      assertThat(layout.baseline()).isCloseTo(20.2f, within(1e-3f));
      assertThat(layout.height()).isCloseTo(28f, within(1e-3f));
    }

    @Test
    @DisplayName("Should place side-set scripts on both sides of the base")
    void measure_SideSet_ScriptsBothSides() {
      final SideSetNode sideSet = new SideSetNode(
          text("a", 10), null, null, text("b", 14), text("x", 17), new SourceRange(0, 18));

      final NodeLayout layout = measurer.measure(sideSet, context, engine);

      // Left column 7, kern, base 10, kern, right column 7
      assertThat(layout.width()).isCloseTo(26f, within(1e-3f));
    }
  }
}
