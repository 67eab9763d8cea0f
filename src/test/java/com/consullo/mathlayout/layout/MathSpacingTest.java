package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.OperatorNode;
import com.consullo.mathlayout.core.tree.SizedDelimiterNode;
import com.consullo.mathlayout.core.tree.SymbolNode;
import com.consullo.mathlayout.core.tree.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for atom classification and the inter-atom spacing table.
 *
 * @since 1.0
 */
public class MathSpacingTest {

  private static final SourceRange RANGE = new SourceRange(0, 1);

  @Nested
  @DisplayName("Spacing table")
  class Table {

    @Test
    @DisplayName("Should put a medium space between an ordinary atom and a binary operator")
    void spaceBetween_OrdBin_Medium() {
      assertThat(MathSpacing.spaceBetween(AtomType.ORD, AtomType.BIN, false)).isEqualTo(SpaceRule.MEDIUM);
    }

    @Test
    @DisplayName("Should drop medium and thick spaces in script styles")
    void spaceBetween_ScriptStyle_SuppressesMediumAndThick() {
      assertThat(MathSpacing.spaceBetween(AtomType.ORD, AtomType.BIN, true)).isEqualTo(SpaceRule.NONE);
      assertThat(MathSpacing.spaceBetween(AtomType.ORD, AtomType.REL, true)).isEqualTo(SpaceRule.NONE);
    }

    @Test
    @DisplayName("Should keep thin spaces in script styles")
    void spaceBetween_ScriptStyleThin_Kept() {
      assertThat(MathSpacing.spaceBetween(AtomType.ORD, AtomType.OP, true)).isEqualTo(SpaceRule.THIN);
    }

    @Test
    @DisplayName("Should treat impossible combinations as no space")
    void spaceBetween_BinBin_None() {
      assertThat(MathSpacing.spaceBetween(AtomType.BIN, AtomType.BIN, false)).isEqualTo(SpaceRule.NONE);
    }

    @Test
    @DisplayName("Should put a thick space around relations")
    void spaceBetween_RelOrd_Thick() {
      assertThat(MathSpacing.spaceBetween(AtomType.REL, AtomType.ORD, false)).isEqualTo(SpaceRule.THICK);
      assertThat(SpaceRule.THICK.emFactor()).isEqualTo(5f / 18f);
    }
  }

  @Nested
  @DisplayName("Classification")
  class Classification {

    @Test
    @DisplayName("Should classify single-character text by its role")
    void classify_SingleCharText_ByCharacter() {
      assertThat(MathSpacing.classify(new TextNode("+", RANGE))).isEqualTo(AtomType.BIN);
      assertThat(MathSpacing.classify(new TextNode("=", RANGE))).isEqualTo(AtomType.REL);
      assertThat(MathSpacing.classify(new TextNode(",", RANGE))).isEqualTo(AtomType.PUNCT);
      assertThat(MathSpacing.classify(new TextNode("(", RANGE))).isEqualTo(AtomType.OPEN);
      assertThat(MathSpacing.classify(new TextNode("x", RANGE))).isEqualTo(AtomType.ORD);
      assertThat(MathSpacing.classify(new TextNode("xy", RANGE))).isEqualTo(AtomType.ORD);
    }

    @Test
    @DisplayName("Should classify symbols by name before falling back to the glyph")
    void classify_Symbols_ByNameThenGlyph() {
      assertThat(MathSpacing.classify(new SymbolNode("times", "×", RANGE))).isEqualTo(AtomType.BIN);
      assertThat(MathSpacing.classify(new SymbolNode("leq", "≤", RANGE))).isEqualTo(AtomType.REL);
      assertThat(MathSpacing.classify(new SymbolNode("custom", "≠", RANGE))).isEqualTo(AtomType.REL);
      assertThat(MathSpacing.classify(new SymbolNode("alpha", "α", RANGE))).isEqualTo(AtomType.ORD);
    }

    @Test
    @DisplayName("Should classify operators, fractions and sized delimiters")
    void classify_Compounds_ByKind() {
      final TextNode x = new TextNode("x", RANGE);

      assertThat(MathSpacing.classify(new OperatorNode("sin", RANGE))).isEqualTo(AtomType.OP);
      assertThat(MathSpacing.classify(new BigOperatorNode("sum", null, null, null, RANGE))).isEqualTo(AtomType.OP);
      assertThat(MathSpacing.classify(new FractionNode(x, x, RANGE))).isEqualTo(AtomType.INNER);
      assertThat(MathSpacing.classify(new SizedDelimiterNode("\\langle", 1.2f, RANGE))).isEqualTo(AtomType.OPEN);
      assertThat(MathSpacing.classify(new SizedDelimiterNode(")", 1.2f, RANGE))).isEqualTo(AtomType.CLOSE);
    }
  }
}
