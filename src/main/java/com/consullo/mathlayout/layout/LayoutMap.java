package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Side table of node positions collected during one measurement pass.
 *
 * <p>
 * An editor surface owns one map, clears it before every pass and lets {@link LayoutEngine} fill
 * it. After the pass it is only read, by cursor placement and hit-testing. Not thread-safe: reads
 * must not overlap a pass that is writing.
 * </p>
 *
 * @since 1.0
 */
public final class LayoutMap {

  private final List<NodeLayoutEntry> entries = new ArrayList<>();

  public void add(final NodeLayoutEntry entry) {
    Validate.notNull(entry, "entry must not be null");
    entries.add(entry);
  }

  public List<NodeLayoutEntry> entries() {
    return Collections.unmodifiableList(entries);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public void clear() {
    entries.clear();
  }

  /**
   * Smallest-area entry whose box contains the point, edges included.
   *
   * @param x x coordinate relative to the content origin
   * @param y y coordinate relative to the content origin
   * @return hit entry, or null
   */
  public NodeLayoutEntry hitTest(final float x, final float y) {
    NodeLayoutEntry best = null;
    for (NodeLayoutEntry entry : entries) {
      if (entry.containsPoint(x, y) && (best == null || entry.area() < best.area())) {
        best = entry;
      }
    }
    return best;
  }

  /**
   * Entry with the shortest source range containing {@code offset} (half-open).
   *
   * @param offset source offset
   * @return innermost entry, or null
   */
  public NodeLayoutEntry entryAt(final int offset) {
    NodeLayoutEntry best = null;
    for (NodeLayoutEntry entry : entries) {
      SourceRange range = entry.range();
      if (range != null && range.contains(offset)
          && (best == null || range.length() < best.range().length())) {
        best = entry;
      }
    }
    return best;
  }

  /**
   * Entries whose source range overlaps {@code range}, in insertion order.
   *
   * @param range source range
   * @return overlapping entries
   */
  public List<NodeLayoutEntry> entriesInRange(final SourceRange range) {
    Validate.notNull(range, "range must not be null");
    List<NodeLayoutEntry> out = new ArrayList<>();
    for (NodeLayoutEntry entry : entries) {
      if (range.overlaps(entry.range())) {
        out.add(entry);
      }
    }
    return out;
  }
}
