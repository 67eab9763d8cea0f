package com.consullo.mathlayout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outline made of straight and cubic segments, built with {@link #builder()}.
 *
 * @since 1.0
 */
public final class VectorPath {

  /**
   * Segment verbs.
   */
  public enum Verb {
    MOVE_TO,
    LINE_TO,
    CUBIC_TO,
    CLOSE
  }

  /**
   * One path segment. {@code points} holds x/y pairs: one pair for move and line, three for cubic,
   * none for close.
   *
   * @param verb segment verb
   * @param points coordinates
   */
  public record Segment(Verb verb, float[] points) {
  }

  private final List<Segment> segments;

  private VectorPath(List<Segment> segments) {
    this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
  }

  public List<Segment> getSegments() {
    return segments;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private final List<Segment> segments = new ArrayList<>();

    private Builder() {
    }

    public Builder moveTo(float x, float y) {
      segments.add(new Segment(Verb.MOVE_TO, new float[]{x, y}));
      return this;
    }

    public Builder lineTo(float x, float y) {
      requireStarted();
      segments.add(new Segment(Verb.LINE_TO, new float[]{x, y}));
      return this;
    }

    public Builder cubicTo(float x1, float y1, float x2, float y2, float x3, float y3) {
      requireStarted();
      segments.add(new Segment(Verb.CUBIC_TO, new float[]{x1, y1, x2, y2, x3, y3}));
      return this;
    }

    public Builder close() {
      requireStarted();
      segments.add(new Segment(Verb.CLOSE, new float[0]));
      return this;
    }

    public VectorPath build() {
      return new VectorPath(segments);
    }

    private void requireStarted() {
      if (segments.isEmpty()) {
        throw new IllegalStateException("path must start with moveTo.");
      }
    }
  }
}
