package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.FontSpec;
import com.consullo.mathlayout.core.GlyphBounds;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for precise and estimated ink bounds.
 *
 * @since 1.0
 */
public class InkBoundsEstimatorTest {

  private final FontSpec font = new FontSpec(FontFamily.EXTENSION, 30f, 400, false);
  private final ShapedText integral = new ShapedText("∫", font, 15f, 30f, 24f);

  @Test
  @DisplayName("Should trim the extension line box around the ink")
  void estimate_Extension_TrimsBlankSpace() {
    final InkBounds ink = InkBoundsEstimator.estimate(integral, InkBoundsEstimator.Category.EXTENSION);

    assertThat(ink.inkHeight()).isCloseTo(22.08f, within(1e-3f));
    assertThat(ink.inkTopOffset()).isCloseTo(2.4f, within(1e-3f));
    assertThat(ink.inkBaseline()).isCloseTo(21.6f, within(1e-3f));
  }

  @Test
  @DisplayName("Should keep the line box as-is for text")
  void estimate_Text_Identity() {
    final InkBounds ink = InkBoundsEstimator.estimate(integral, InkBoundsEstimator.Category.TEXT);

    assertThat(ink).isEqualTo(new InkBounds(30f, 0f, 24f));
  }

  @Test
  @DisplayName("Should derive ink bounds from exact glyph bounds when the shaper provides them")
  void measurePrecise_GlyphBoundsAvailable_UsesThem() {
    final Shaper shaper = mock(Shaper.class);
    when(shaper.glyphBounds(anyString(), any(FontSpec.class), any(byte[].class)))
        .thenReturn(Optional.of(new GlyphBounds(20f, 6f, 12f)));

    final Optional<InkBounds> ink = InkBoundsEstimator.measurePrecise(shaper, integral, font, new byte[] {1});

    assertThat(ink).contains(new InkBounds(26f, 4f, 20f));
  }

  @Test
  @DisplayName("Should report no precise bounds when the shaper cannot read the font")
  void measurePrecise_NoGlyphBounds_Empty() {
    final Shaper shaper = mock(Shaper.class);
    when(shaper.glyphBounds(anyString(), any(FontSpec.class), any(byte[].class))).thenReturn(Optional.empty());

    assertThat(InkBoundsEstimator.measurePrecise(shaper, integral, font, new byte[] {1})).isEmpty();
  }
}
