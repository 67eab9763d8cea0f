package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SubscriptNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for super- and subscript placement at 20px. Scripts are 14px, raised 9px or lowered
 * 5px, after a 1px kern.
 *
 * @since 1.0
 */
public class ScriptMeasurerTest {

  private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
  private final ScriptMeasurer measurer = new ScriptMeasurer();
  private final RenderContext context = RenderContext.builder().fontSizePx(20f).build();

  private static MathNode text(final String content, final int start) {
    return new TextNode(content, new SourceRange(start, start + content.length()));
  }

  @Test
  @DisplayName("Should raise a superscript above the base baseline")
  void measure_Superscript_RaisesScript() {
    final NodeLayout layout = measurer.measure(
        new SuperscriptNode(text("x", 0), text("2", 2), new SourceRange(0, 3)), context, engine);

    assertThat(layout.width()).isCloseTo(18f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(20.2f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(24.2f, within(1e-3f));
  }

  @Test
  @DisplayName("Should lower a subscript below the base baseline")
  void measure_Subscript_LowersScript() {
    final NodeLayout layout = measurer.measure(
        new SubscriptNode(text("x", 0), text("2", 2), new SourceRange(0, 3)), context, engine);

    assertThat(layout.baseline()).isCloseTo(16f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(23.8f, within(1e-3f));
  }

  @Test
  @DisplayName("Should stack both scripts in one column when a superscript wraps a subscript")
  void measure_NestedScripts_SharedColumn() {
    final MathNode sub = new SubscriptNode(text("x", 0), text("1", 2), new SourceRange(0, 3));

    final NodeLayout layout = measurer.measure(
        new SuperscriptNode(sub, text("2", 4), new SourceRange(0, 5)), context, engine);

    assertThat(layout.width()).isCloseTo(18f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(20.2f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(28f, within(1e-3f));
  }

  @Test
  @DisplayName("Should centre a caption above an overbrace")
  void measure_OverbraceCaption_CaptionAbove() {
    final MathNode brace = new AccentNode(text("x", 10), AccentNode.Kind.OVERBRACE, new SourceRange(0, 12));

    final NodeLayout layout = measurer.measure(
        new SuperscriptNode(brace, text("n", 13), new SourceRange(0, 14)), context, engine);

    // Brace box 28.2 tall with baseline 23.6, caption 14 tall, gap 1.6
    assertThat(layout.width()).isCloseTo(10f, within(1e-3f));
    assertThat(layout.height()).isCloseTo(28.2f + 1.6f + 14f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(14f + 1.6f + 23.6f, within(1e-3f));
  }

  @Test
  @DisplayName("Should reject nodes that are not scripts")
  void measure_NotAScript_Throws() {
    assertThatThrownBy(() -> measurer.measure(text("x", 0), context, engine))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported node type");
  }
}
