package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.FontSpec;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the math axis measurement and its fallback.
 *
 * @since 1.0
 */
public class MathAxisTest {

  private final RenderContext context = RenderContext.builder().fontSizePx(20f).build();

  @Test
  @DisplayName("Should place the axis at the centre of the minus sign")
  void axisHeight_SaneMetrics_UsesMinusCentre() {
    assertThat(MathAxis.axisHeight(context, new FixedMetricShaper())).isCloseTo(6f, within(1e-4f));
  }

  @Test
  @DisplayName("Should fall back to a quarter of the font size for implausible metrics")
  void axisHeight_CentreTooHigh_FallsBack() {
    final Shaper shaper = mock(Shaper.class);
    when(shaper.shape(eq("-"), any(FontSpec.class)))
        .thenReturn(new ShapedText("-", context.fontSpec(), 10f, 10f, 20f));

    assertThat(MathAxis.axisHeight(context, shaper)).isEqualTo(5f);
  }
}
