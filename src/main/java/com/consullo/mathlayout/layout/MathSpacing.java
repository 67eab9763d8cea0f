package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.core.tree.BoxedNode;
import com.consullo.mathlayout.core.tree.CasesNode;
import com.consullo.mathlayout.core.tree.DelimitedNode;
import com.consullo.mathlayout.core.tree.ExtensibleArrowNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.MatrixNode;
import com.consullo.mathlayout.core.tree.OperatorNode;
import com.consullo.mathlayout.core.tree.SimpleMathNodeVisitor;
import com.consullo.mathlayout.core.tree.SizedDelimiterNode;
import com.consullo.mathlayout.core.tree.SymbolNode;
import com.consullo.mathlayout.core.tree.TextNode;
import java.util.Set;

/**
 * TeX inter-atom spacing: node classification plus the 8x8 spacing table.
 *
 * <p>
 * Rows are the left atom, columns the right atom, both in {@link AtomType} order. A null cell is a
 * combination TeX never produces and is treated as no space. Medium and thick spaces vanish in
 * script styles.
 * </p>
 *
 * @since 1.0
 */
public final class MathSpacing {

  private static final SpaceRule N = SpaceRule.NONE;
  private static final SpaceRule T = SpaceRule.THIN;
  private static final SpaceRule M = SpaceRule.MEDIUM;
  private static final SpaceRule K = SpaceRule.THICK;

  private static final SpaceRule[][] SPACING_TABLE = {
      //        ORD   OP    BIN   REL   OPEN  CLOSE PUNCT INNER
      /* ORD */ {N, T, M, K, N, N, N, T},
      /* OP  */ {T, T, null, K, N, N, N, T},
      /* BIN */ {M, M, null, null, M, null, null, M},
      /* REL */ {K, K, null, N, K, N, N, K},
      /* OPN */ {N, N, null, N, N, N, N, N},
      /* CLS */ {N, T, M, K, N, N, N, T},
      /* PCT */ {T, T, null, T, T, T, T, T},
      /* INR */ {T, T, M, K, T, N, T, T}
  };

  private static final Set<String> BINARY_OPERATORS = Set.of(
      "plus", "minus", "times", "div", "cdot",
      "pm", "mp", "ast", "star", "circ",
      "oplus", "ominus", "otimes", "oslash",
      "cup", "cap", "setminus", "wedge", "vee");

  private static final Set<String> RELATION_SYMBOLS = Set.of(
      "equals", "neq", "approx", "equiv", "sim", "simeq", "cong",
      "leq", "geq", "ll", "gg", "le", "ge",
      "subset", "supset", "subseteq", "supseteq",
      "in", "ni", "notin",
      "rightarrow", "leftarrow", "leftrightarrow",
      "Rightarrow", "Leftarrow", "Leftrightarrow",
      "longrightarrow", "longleftarrow", "longleftrightarrow",
      "Longleftarrow", "Longrightarrow", "Longleftrightarrow",
      "implies", "iff",
      "mapsto", "to", "longmapsto",
      "propto", "perp", "parallel", "mid",
      "prec", "succ", "preceq", "succeq",
      "vdash", "dashv");

  private static final Set<String> OPEN_DELIMITERS =
      Set.of("(", "[", "{", "\\{", "\\langle", "\\lfloor", "\\lceil");

  private static final Set<String> CLOSE_DELIMITERS =
      Set.of(")", "]", "}", "\\}", "\\rangle", "\\rfloor", "\\rceil");

  private static final Classifier CLASSIFIER = new Classifier();

  private MathSpacing() {
  }

  /**
   * Spacing between two adjacent atoms.
   *
   * @param left left atom class
   * @param right right atom class
   * @param isScript true in script and scriptscript styles
   * @return spacing rule, never null
   */
  public static SpaceRule spaceBetween(final AtomType left, final AtomType right, final boolean isScript) {
    SpaceRule rule = SPACING_TABLE[left.ordinal()][right.ordinal()];
    if (rule == null) {
      return SpaceRule.NONE;
    }
    if (isScript && (rule == SpaceRule.MEDIUM || rule == SpaceRule.THICK)) {
      return SpaceRule.NONE;
    }
    return rule;
  }

  /**
   * Atom class of a node for spacing purposes.
   *
   * @param node node
   * @return atom class
   */
  public static AtomType classify(final MathNode node) {
    return node.accept(CLASSIFIER, null);
  }

  static AtomType classifyText(String content) {
    if (content.length() == 1) {
      char ch = content.charAt(0);
      if (ch == ',' || ch == ';' || ch == ':') {
        return AtomType.PUNCT;
      }
      if (ch == '(' || ch == '[') {
        return AtomType.OPEN;
      }
      if (ch == ')' || ch == ']') {
        return AtomType.CLOSE;
      }
      if (ch == '+' || ch == '-' || ch == '*') {
        return AtomType.BIN;
      }
      if (ch == '=' || ch == '<' || ch == '>') {
        return AtomType.REL;
      }
    }
    return AtomType.ORD;
  }

  static AtomType classifySymbol(String name, String unicode) {
    if (BINARY_OPERATORS.contains(name)) {
      return AtomType.BIN;
    }
    if (RELATION_SYMBOLS.contains(name)) {
      return AtomType.REL;
    }
    if (unicode.length() == 1) {
      char ch = unicode.charAt(0);
      if ("+-×÷·".indexOf(ch) >= 0) {
        return AtomType.BIN;
      }
      if ("=<>≤≥≈≡≠".indexOf(ch) >= 0) {
        return AtomType.REL;
      }
      if (ch == ',' || ch == ';' || ch == ':') {
        return AtomType.PUNCT;
      }
    }
    return AtomType.ORD;
  }

  static AtomType classifyDelimiter(String delimiter) {
    if (OPEN_DELIMITERS.contains(delimiter)) {
      return AtomType.OPEN;
    }
    if (CLOSE_DELIMITERS.contains(delimiter)) {
      return AtomType.CLOSE;
    }
    return AtomType.ORD;
  }

  private static final class Classifier extends SimpleMathNodeVisitor<AtomType, Void> {

    @Override
    protected AtomType defaultAction(MathNode node, Void param) {
      return AtomType.ORD;
    }

    @Override
    public AtomType visitText(TextNode node, Void param) {
      return classifyText(node.content());
    }

    @Override
    public AtomType visitSymbol(SymbolNode node, Void param) {
      return classifySymbol(node.name(), node.unicode());
    }

    @Override
    public AtomType visitOperator(OperatorNode node, Void param) {
      return AtomType.OP;
    }

    @Override
    public AtomType visitBigOperator(BigOperatorNode node, Void param) {
      return AtomType.OP;
    }

    @Override
    public AtomType visitFraction(FractionNode node, Void param) {
      return AtomType.INNER;
    }

    @Override
    public AtomType visitBinomial(BinomialNode node, Void param) {
      return AtomType.INNER;
    }

    @Override
    public AtomType visitDelimited(DelimitedNode node, Void param) {
      return AtomType.INNER;
    }

    @Override
    public AtomType visitMatrix(MatrixNode node, Void param) {
      return node.bracket() == MatrixNode.Bracket.PLAIN ? AtomType.ORD : AtomType.INNER;
    }

    @Override
    public AtomType visitCases(CasesNode node, Void param) {
      return AtomType.INNER;
    }

    @Override
    public AtomType visitBoxed(BoxedNode node, Void param) {
      return AtomType.INNER;
    }

    @Override
    public AtomType visitExtensibleArrow(ExtensibleArrowNode node, Void param) {
      return AtomType.REL;
    }

    @Override
    public AtomType visitSizedDelimiter(SizedDelimiterNode node, Void param) {
      return classifyDelimiter(node.delimiter());
    }
  }
}
