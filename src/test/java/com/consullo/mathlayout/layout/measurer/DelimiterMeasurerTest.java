package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.DelimitedNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SizedDelimiterNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for auto-sized and explicitly sized delimiters at 20px.
 *
 * @since 1.0
 */
public class DelimiterMeasurerTest {

  private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
  private final DelimiterMeasurer measurer = new DelimiterMeasurer();
  private final RenderContext context = RenderContext.builder().fontSizePx(20f).build();
  private final List<MathNode> content = List.of(new TextNode("x", new SourceRange(7, 8)));

  @Test
  @DisplayName("Should pad the content and grow both delimiters to match")
  void measure_Parentheses_PaddedAndStretched() {
    final NodeLayout layout = measurer.measure(
        new DelimitedNode("(", ")", content, new SourceRange(0, 16)), context, engine);

    // Delimiters grown to 26px are 13px wide each
    assertThat(layout.height()).isCloseTo(26f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(19f, within(1e-3f));
    assertThat(layout.width()).isCloseTo(36f, within(1e-3f));
  }

  @Test
  @DisplayName("Should leave out a null delimiter")
  void measure_NullLeftDelimiter_Omitted() {
    final NodeLayout layout = measurer.measure(
        new DelimitedNode(DelimitedNode.NONE, ")", content, new SourceRange(0, 16)), context, engine);

    assertThat(layout.width()).isCloseTo(23f, within(1e-3f));
  }

  @Test
  @DisplayName("Should centre a sized delimiter on the math axis")
  void measure_SizedDelimiter_CentredOnAxis() {
    final NodeLayout layout = measurer.measure(
        new SizedDelimiterNode("(", 2f, new SourceRange(0, 6)), context, engine);

    assertThat(layout.height()).isCloseTo(40f, within(1e-3f));
    assertThat(layout.baseline()).isCloseTo(26f, within(1e-3f));
  }
}
