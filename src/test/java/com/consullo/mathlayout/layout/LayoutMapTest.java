package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for lookups on {@link LayoutMap}.
 *
 * @since 1.0
 */
public class LayoutMapTest {

  private final MathNode a = new TextNode("a", new SourceRange(6, 7));
  private final MathNode b = new TextNode("b", new SourceRange(9, 10));
  private final MathNode fraction = new FractionNode(a, b, new SourceRange(0, 11));

  private LayoutMap map;

  @BeforeEach
  void setUp() {
    map = new LayoutMap();
    map.add(new NodeLayoutEntry(fraction, 0f, 0f, 40f, 60f, 32f));
    map.add(new NodeLayoutEntry(a, 15f, 0f, 10f, 25f, 20f));
    map.add(new NodeLayoutEntry(b, 15f, 35f, 10f, 25f, 20f));
  }

  @Test
  @DisplayName("Should prefer the smallest box containing the point")
  void hitTest_PointInsideChild_ReturnsChild() {
    assertThat(map.hitTest(20f, 10f).node()).isSameAs(a);
    assertThat(map.hitTest(2f, 10f).node()).isSameAs(fraction);
  }

  @Test
  @DisplayName("Should include box edges in hit tests")
  void hitTest_OnEdge_Hits() {
    assertThat(map.hitTest(40f, 60f).node()).isSameAs(fraction);
    assertThat(map.hitTest(41f, 60f)).isNull();
  }

  @Test
  @DisplayName("Should return the entry with the shortest range holding the offset")
  void entryAt_OffsetInNumerator_ReturnsInnermost() {
    assertThat(map.entryAt(6).node()).isSameAs(a);
    assertThat(map.entryAt(7).node()).isSameAs(fraction);
    assertThat(map.entryAt(11)).isNull();
  }

  @Test
  @DisplayName("Should list overlapping entries in insertion order")
  void entriesInRange_Overlap_InsertionOrder() {
    assertThat(map.entriesInRange(new SourceRange(8, 10)))
        .extracting(NodeLayoutEntry::node)
        .containsExactly(fraction, b);
  }

  @Test
  @DisplayName("Should be empty after clearing")
  void clear_Populated_Empty() {
    map.clear();

    assertThat(map.isEmpty()).isTrue();
    assertThat(map.hitTest(20f, 10f)).isNull();
  }
}
