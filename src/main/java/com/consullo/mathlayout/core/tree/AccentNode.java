package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.List;

/**
 * Accent or decoration over or under its content, e.g. {@code \hat{x}} or {@code \overbrace{...}}.
 *
 * @param content decorated node
 * @param kind accent kind
 * @param sourceRange source span, may be null
 * @since 1.0
 */
public record AccentNode(MathNode content, Kind kind, SourceRange sourceRange) implements MathNode {

  /**
   * Accent kinds. Wide kinds are drawn as vector strokes sized to the content.
   */
  public enum Kind {
    HAT(false),
    TILDE(false),
    BAR(false),
    VEC(false),
    DOT(false),
    DDOT(false),
    WIDEHAT(true),
    OVERRIGHTARROW(true),
    OVERLEFTARROW(true),
    OVERLINE(true),
    UNDERLINE(true),
    OVERBRACE(true),
    UNDERBRACE(true),
    CANCEL(true);

    private final boolean wide;

    Kind(boolean wide) {
      this.wide = wide;
    }

    public boolean isWide() {
      return wide;
    }

    public boolean isUnder() {
      return this == UNDERLINE || this == UNDERBRACE;
    }
  }

  public AccentNode {
    if (content == null || kind == null) {
      throw new IllegalArgumentException("content/kind must not be null.");
    }
  }

  @Override
  public List<MathNode> children() {
    return List.of(content);
  }

  @Override
  public <R, P> R accept(MathNodeVisitor<R, P> visitor, P param) {
    return visitor.visitAccent(this, param);
  }
}
