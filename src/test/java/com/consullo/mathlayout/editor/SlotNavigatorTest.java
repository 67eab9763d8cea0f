package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.DocumentNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.MatrixNode;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.TextNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlotNavigator}.
 *
 * @since 1.0
 */
public class SlotNavigatorTest {

  /** {@code \frac{}{}+x} */
  private static MathNode emptyFractionDocument() {
    final FractionNode fraction = new FractionNode(
        new GroupNode(List.of(), new SourceRange(5, 7)),
        new GroupNode(List.of(), new SourceRange(7, 9)),
        new SourceRange(0, 9));
    return new DocumentNode(List.of(
        fraction,
        new TextNode("+", new SourceRange(9, 10)),
        new TextNode("x", new SourceRange(10, 11))), new SourceRange(0, 11));
  }

  @Test
  @DisplayName("Should jump from the numerator into the denominator")
  void nextSlotOffset_InNumerator_DenominatorContent() {
    assertThat(SlotNavigator.nextSlotOffset(6, emptyFractionDocument())).hasValue(8);
  }

  @Test
  @DisplayName("Should treat the closing brace as part of the slot")
  void nextSlotOffset_OnClosingBrace_StillCurrentSlot() {
    assertThat(SlotNavigator.nextSlotOffset(7, emptyFractionDocument())).hasValue(8);
  }

  @Test
  @DisplayName("Should leave the construct from its last slot")
  void nextSlotOffset_InLastSlot_ConstructEnd() {
    assertThat(SlotNavigator.nextSlotOffset(8, emptyFractionDocument())).hasValue(9);
  }

  @Test
  @DisplayName("Should report nothing outside any construct with slots")
  void nextSlotOffset_PlainText_Empty() {
    assertThat(SlotNavigator.nextSlotOffset(10, emptyFractionDocument())).isEmpty();
  }

  @Test
  @DisplayName("Should visit the root index before the radicand")
  void orderedSlots_NthRoot_IndexFirst() {
    final MathNode index = new GroupNode(List.of(), new SourceRange(5, 7));
    final MathNode content = new GroupNode(List.of(), new SourceRange(7, 9));

    assertThat(SlotNavigator.orderedSlots(new RootNode(content, index, new SourceRange(0, 9))))
        .containsExactly(index, content);
    assertThat(SlotNavigator.orderedSlots(new RootNode(content, null, new SourceRange(0, 7))))
        .containsExactly(content);
  }

  @Test
  @DisplayName("Should exit a superscript from its exponent")
  void nextSlotOffset_InExponent_ScriptEnd() {
    final MathNode power = new SuperscriptNode(new TextNode("x", new SourceRange(0, 1)),
        new GroupNode(List.of(), new SourceRange(2, 4)), new SourceRange(0, 4));

    assertThat(SlotNavigator.nextSlotOffset(3, power)).hasValue(4);
  }

  @Test
  @DisplayName("Should reject a null tree")
  void nextSlotOffset_NullTree_Throws() {
    assertThatThrownBy(() -> SlotNavigator.nextSlotOffset(0, null))
        .isInstanceOf(NullPointerException.class);
  }

  /** {@code \begin{pmatrix}a&b\\c&d\end{pmatrix}} */
  private static MathNode pmatrix() {
    return new MatrixNode(List.of(
        List.of(new TextNode("a", new SourceRange(15, 16)), new TextNode("b", new SourceRange(17, 18))),
        List.of(new TextNode("c", new SourceRange(20, 21)), new TextNode("d", new SourceRange(22, 23)))),
        MatrixNode.Bracket.PAREN, new SourceRange(0, 36));
  }

  @Test
  @DisplayName("Should step through matrix cells row by row")
  void nextSlotOffset_InMatrixCell_NextCell() {
    assertThat(SlotNavigator.nextSlotOffset(15, pmatrix())).hasValue(17);
    assertThat(SlotNavigator.nextSlotOffset(18, pmatrix())).hasValue(20);
  }

  @Test
  @DisplayName("Should leave the matrix from its last cell")
  void nextSlotOffset_InLastMatrixCell_MatrixEnd() {
    assertThat(SlotNavigator.nextSlotOffset(22, pmatrix())).hasValue(36);
  }
}
