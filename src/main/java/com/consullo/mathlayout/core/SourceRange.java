package com.consullo.mathlayout.core;

/**
 * Half-open span {@code [start, end)} over the source text a tree node was parsed from.
 *
 * <p>
 * Two containment predicates are offered. {@link #contains(int)} is the usual half-open test and
 * is used for leaf lookups. {@link #containsInclusive(int)} also accepts {@code end} and is used
 * when matching the boundaries of compound constructs, so that an offset sitting on a closing
 * brace still belongs to the construct it closes.
 * </p>
 *
 * @param start first offset covered
 * @param end offset one past the last covered character
 * @since 1.0
 */
public record SourceRange(int start, int end) {

  /** The empty range at offset zero. */
  public static final SourceRange EMPTY = new SourceRange(0, 0);

  public SourceRange {
    if (start < 0) {
      throw new IllegalArgumentException("start must be non-negative.");
    }
    if (end < start) {
      throw new IllegalArgumentException("end must be >= start.");
    }
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return end == start;
  }

  /**
   * Half-open containment: {@code start <= offset < end}.
   *
   * @param offset source offset
   * @return true when the offset falls inside the range
   */
  public boolean contains(final int offset) {
    return offset >= start && offset < end;
  }

  /**
   * Closed containment: {@code start <= offset <= end}.
   *
   * @param offset source offset
   * @return true when the offset falls inside the range or on its end
   */
  public boolean containsInclusive(final int offset) {
    return offset >= start && offset <= end;
  }

  public boolean overlaps(final SourceRange other) {
    return other != null && start < other.end && other.start < end;
  }

  /**
   * Returns the smallest range covering both this range and {@code other}.
   *
   * @param other other range, may be null
   * @return merged range
   */
  public SourceRange merge(final SourceRange other) {
    if (other == null) {
      return this;
    }
    return new SourceRange(Math.min(start, other.start), Math.max(end, other.end));
  }
}
