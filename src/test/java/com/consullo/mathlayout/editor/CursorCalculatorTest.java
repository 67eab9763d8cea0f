package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.FixedMetricShaper;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.DocumentNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.LayoutEngine;
import com.consullo.mathlayout.layout.LayoutEngineConfig;
import com.consullo.mathlayout.layout.LayoutMap;
import com.consullo.mathlayout.layout.NodeLayoutEntry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CursorCalculator}.
 *
 * @since 1.0
 */
public class CursorCalculatorTest {

  private static MathNode text(final String content, final int start) {
    return new TextNode(content, new SourceRange(start, start + content.length()));
  }

  @Nested
  @DisplayName("Flat row \"x + y\"")
  class FlatRow {

    private LayoutMap map;

    @BeforeEach
    void setUp() {
      map = new LayoutMap();
      map.add(new NodeLayoutEntry(text("x", 0), 0f, 0f, 10f, 20f, 16f));
      map.add(new NodeLayoutEntry(text("+", 2), 15f, 0f, 10f, 20f, 16f));
      map.add(new NodeLayoutEntry(text("y", 4), 30f, 0f, 10f, 20f, 16f));
    }

    @Test
    @DisplayName("Should place the caret at the left edge of the leaf holding the offset")
    void calculate_OffsetAtLeafStart_LeftEdge() {
      final Optional<CursorPosition> caret = CursorCalculator.calculate(2, map, 0f, 0f);

      assertThat(caret).contains(new CursorPosition(15f, 0f, 20f));
    }

    @Test
    @DisplayName("Should place the caret at the right edge of a leaf ending at the offset")
    void calculate_OffsetAfterLeaf_RightEdgeWithPadding() {
      final Optional<CursorPosition> caret = CursorCalculator.calculate(1, map, 5f, 3f);

      assertThat(caret).contains(new CursorPosition(15f, 3f, 20f));
    }

    @Test
    @DisplayName("Should never move the caret left as the offset grows")
    void calculate_IncreasingOffsets_MonotoneX() {
      float previous = -1f;
      for (int offset = 0; offset <= 5; offset++) {
        final float x = CursorCalculator.calculate(offset, map, 0f, 0f).orElseThrow().x();
        assertThat(x).isGreaterThanOrEqualTo(previous);
        previous = x;
      }
      assertThat(previous).isEqualTo(40f);
    }

    @Test
    @DisplayName("Should fall back to the nearest preceding entry past the end")
    void calculate_OffsetPastEnd_NearestPreceding() {
      final Optional<CursorPosition> caret = CursorCalculator.calculate(9, map, 0f, 0f);

      assertThat(caret).contains(new CursorPosition(40f, 0f, 20f));
    }

    @Test
    @DisplayName("Should round a hit inside a leaf to the closer side")
    void hitTestToOffset_InsideLeaf_RoundsToCloserSide() {
      assertThat(CursorCalculator.hitTestToOffset(2f, 10f, map, 0f, 0f, 5)).isZero();
      assertThat(CursorCalculator.hitTestToOffset(7f, 10f, map, 0f, 0f, 5)).isEqualTo(1);
      assertThat(CursorCalculator.hitTestToOffset(38f, 13f, map, 5f, 3f, 5)).isEqualTo(4);
    }

    @Test
    @DisplayName("Should snap a point outside every box to the nearest endpoint")
    void hitTestToOffset_Miss_NearestEndpoint() {
      assertThat(CursorCalculator.hitTestToOffset(100f, 10f, map, 0f, 0f, 5)).isEqualTo(5);
      assertThat(CursorCalculator.hitTestToOffset(-50f, 10f, map, 0f, 0f, 5)).isZero();
    }

    @Test
    @DisplayName("Should clamp hit results to the text length")
    void hitTestToOffset_ShortText_Clamped() {
      assertThat(CursorCalculator.hitTestToOffset(100f, 10f, map, 0f, 0f, 3)).isEqualTo(3);
    }
  }

  @Nested
  @DisplayName("Fraction \\frac{ab}{xy}")
  class Fraction {

    private LayoutMap map;

    @BeforeEach
    void setUp() {
      final MathNode numerator = new GroupNode(List.of(text("a", 6), text("b", 7)), new SourceRange(5, 9));
      final MathNode denominator = new GroupNode(List.of(text("x", 10), text("y", 11)), new SourceRange(9, 13));
      map = new LayoutMap();
      map.add(new NodeLayoutEntry(
          new FractionNode(numerator, denominator, new SourceRange(0, 13)), 0f, 0f, 40f, 60f, 36f));
    }

    @Test
    @DisplayName("Should place numerator offsets in the upper half")
    void calculate_NumeratorOffset_UpperHalf() {
      final CursorPosition caret = CursorCalculator.calculate(7, map, 0f, 0f).orElseThrow();

      assertThat(caret.x()).isCloseTo(20f, within(1e-3f));
      assertThat(caret.y()).isZero();
      assertThat(caret.height()).isCloseTo(30f, within(1e-3f));
    }

    @Test
    @DisplayName("Should place denominator offsets in the lower half")
    void calculate_DenominatorOffset_LowerHalf() {
      final CursorPosition caret = CursorCalculator.calculate(12, map, 0f, 0f).orElseThrow();

      assertThat(caret.x()).isCloseTo(40f, within(1e-3f));
      assertThat(caret.y()).isCloseTo(30f, within(1e-3f));
    }

    @Test
    @DisplayName("Should map hits in each half into that child's content")
    void hitTestToOffset_Halves_ChildContent() {
      assertThat(CursorCalculator.hitTestToOffset(30f, 10f, map, 0f, 0f, 13)).isEqualTo(8);
      assertThat(CursorCalculator.hitTestToOffset(4f, 45f, map, 0f, 0f, 13)).isEqualTo(10);
    }

    @Test
    @DisplayName("Should hit back the offset a caret was placed for")
    void roundTrip_ChildOffsets_Stable() {
      for (int offset : new int[] {6, 7, 8, 10, 11, 12}) {
        final CursorPosition caret = CursorCalculator.calculate(offset, map, 4f, 4f).orElseThrow();

        final int hit = CursorCalculator.hitTestToOffset(
            caret.x(), caret.y() + caret.height() / 2f, map, 4f, 4f, 13);

        assertThat(hit).as("offset %d", offset).isEqualTo(offset);
      }
    }
  }

  @Nested
  @DisplayName("Script followed by a sibling, x^2+y")
  class ScriptThenSibling {

    private LayoutMap map;

    @BeforeEach
    void setUp() {
      map = new LayoutMap();
      map.add(new NodeLayoutEntry(
          new SuperscriptNode(text("x", 0), text("2", 2), new SourceRange(0, 3)), 0f, 0f, 20f, 30f, 26f));
      map.add(new NodeLayoutEntry(text("+", 3), 25f, 10f, 10f, 20f, 16f));
      map.add(new NodeLayoutEntry(text("y", 4), 40f, 10f, 10f, 20f, 16f));
    }

    @Test
    @DisplayName("Should keep a caret at the end of the exponent inside the exponent region")
    void calculate_ExponentEnd_StaysInExponent() {
      final CursorPosition caret = CursorCalculator.calculate(3, map, 0f, 0f).orElseThrow();

      assertThat(caret.x()).isCloseTo(20f, within(1e-3f));
      assertThat(caret.y()).isZero();
      assertThat(caret.height()).isCloseTo(18f, within(1e-3f));
    }

    @Test
    @DisplayName("Should place the caret after the sibling once the offset leaves the script")
    void calculate_AfterSibling_SiblingRightEdge() {
      final CursorPosition caret = CursorCalculator.calculate(4, map, 0f, 0f).orElseThrow();

      assertThat(caret.x()).isEqualTo(40f);
      assertThat(caret.y()).isEqualTo(10f);
    }
  }

  @Nested
  @DisplayName("Map filled by the layout engine")
  class EngineFilled {

    private final LayoutEngine engine = new LayoutEngine(new FixedMetricShaper(), LayoutEngineConfig.defaults());
    private final LayoutMap map = new LayoutMap();

    /** {@code \frac{a}{b}+x} */
    @BeforeEach
    void setUp() {
      final MathNode fraction = new FractionNode(
          new GroupNode(List.of(text("a", 6)), new SourceRange(5, 8)),
          new GroupNode(List.of(text("b", 9)), new SourceRange(8, 11)),
          new SourceRange(0, 11));
      final MathNode document = new DocumentNode(
          List.of(fraction, text("+", 11), text("x", 12)), new SourceRange(0, 13));
      engine.measure(document, RenderContext.builder().fontSizePx(20f).build(), map);
    }

    @Test
    @DisplayName("Should hit back every caret position computed from a measured formula")
    void roundTrip_MeasuredFormula_Stable() {
      assertThat(map.size()).isEqualTo(3);
      for (int offset : new int[] {6, 7, 9, 10, 11, 12, 13}) {
        final CursorPosition caret = CursorCalculator.calculate(offset, map, 16f, 16f).orElseThrow();

        final int hit = CursorCalculator.hitTestToOffset(
            caret.x(), caret.y() + caret.height() / 2f, map, 16f, 16f, 13);

        assertThat(hit).as("offset %d", offset).isEqualTo(offset);
      }
    }

    @Test
    @DisplayName("Should move the caret right as the offset crosses the formula")
    void calculate_AcrossFormula_NumeratorBeforeOperator() {
      final float numeratorEnd = CursorCalculator.calculate(7, map, 0f, 0f).orElseThrow().x();
      final float operatorStart = CursorCalculator.calculate(11, map, 0f, 0f).orElseThrow().x();
      final float textEnd = CursorCalculator.calculate(13, map, 0f, 0f).orElseThrow().x();

      assertThat(numeratorEnd).isLessThan(operatorStart);
      assertThat(operatorStart).isLessThan(textEnd);
    }
  }

  @Test
  @DisplayName("Should give no caret and the text end for an empty map")
  void emptyMap_NoCaretAndTextEnd() {
    final LayoutMap map = new LayoutMap();

    assertThat(CursorCalculator.calculate(0, map, 0f, 0f)).isEmpty();
    assertThat(CursorCalculator.hitTestToOffset(3f, 3f, map, 0f, 0f, 7)).isEqualTo(7);
  }

  @Test
  @DisplayName("Should reject a null map")
  void calculate_NullMap_Throws() {
    assertThatThrownBy(() -> CursorCalculator.calculate(0, null, 0f, 0f))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("layoutMap");
  }
}
