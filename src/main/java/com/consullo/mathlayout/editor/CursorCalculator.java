package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.layout.LayoutMap;
import com.consullo.mathlayout.layout.NodeLayoutEntry;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Maps between source offsets and caret pixels using the entries of a {@link LayoutMap}.
 *
 * <p>
 * Offset to pixel resolves in tiers, first match wins:
 * <ol>
 * <li>the smallest compound entry containing the offset inclusively, resolved to a child
 * region;</li>
 * <li>the innermost entry containing the offset, interpolated across its width;</li>
 * <li>an entry ending exactly at the offset, at its right edge;</li>
 * <li>the nearest entry before or after the offset.</li>
 * </ol>
 * Pixel to offset hit-tests the map, splits compound hits by child region and falls back to the
 * nearest entry when the point misses every box.
 * </p>
 *
 * <p>
 * Padding is the distance from the surface origin to the content origin of the pass that filled
 * the map. It is added to computed positions and subtracted from hit points.
 * </p>
 *
 * @since 1.0
 */
public final class CursorCalculator {

  /** Vertical distance weight used when a point misses every entry. */
  private static final float NEAREST_VERTICAL_WEIGHT = 4f;

  private CursorCalculator() {
  }

  /**
   * Caret position for a source offset.
   *
   * @param offset source offset
   * @param layoutMap map filled by the last measurement pass
   * @param horizontalPadding content origin x on the surface
   * @param verticalPadding content origin y on the surface
   * @return caret, empty when the map has no entries
   */
  public static Optional<CursorPosition> calculate(
      final int offset,
      final LayoutMap layoutMap,
      final float horizontalPadding,
      final float verticalPadding) {
    Validate.notNull(layoutMap, "layoutMap must not be null");
    if (layoutMap.isEmpty()) {
      return Optional.empty();
    }
    List<NodeLayoutEntry> entries = layoutMap.entries();

    // Step A: compound structures, inclusive of their end
    NodeLayoutEntry compound = findCompoundEntryContaining(entries, offset);
    if (compound != null) {
      Optional<CursorPosition> resolved =
          resolveCompound(compound, offset, horizontalPadding, verticalPadding);
      if (resolved.isPresent()) {
        return resolved;
      }
    }

    // Step B: innermost entry holding the offset
    NodeLayoutEntry exact = layoutMap.entryAt(offset);
    if (exact != null) {
      if (ChildRegions.isCompound(exact.node())) {
        Optional<CursorPosition> resolved =
            resolveCompound(exact, offset, horizontalPadding, verticalPadding);
        if (resolved.isPresent()) {
          return resolved;
        }
      }
      SourceRange range = exact.range();
      float ratio = ratio(offset - range.start(), range.length());
      return Optional.of(new CursorPosition(
          exact.relX() + exact.width() * ratio + horizontalPadding,
          exact.relY() + verticalPadding,
          exact.height()));
    }

    // Step C: an entry ending right at the offset
    NodeLayoutEntry ending = null;
    for (NodeLayoutEntry entry : entries) {
      SourceRange range = entry.range();
      if (range != null && range.end() == offset && (ending == null || entry.right() > ending.right())) {
        ending = entry;
      }
    }
    if (ending != null) {
      if (ChildRegions.isCompound(ending.node())) {
        Optional<CursorPosition> resolved =
            resolveCompound(ending, offset, horizontalPadding, verticalPadding);
        if (resolved.isPresent()) {
          return resolved;
        }
      }
      return Optional.of(rightEdge(ending, horizontalPadding, verticalPadding));
    }

    // Step D: nearest neighbour
    return Optional.of(nearest(entries, offset, horizontalPadding, verticalPadding));
  }

  /**
   * Source offset for a point on the surface.
   *
   * @param px point x on the surface
   * @param py point y on the surface
   * @param layoutMap map filled by the last measurement pass
   * @param horizontalPadding content origin x on the surface
   * @param verticalPadding content origin y on the surface
   * @param textLength length of the source text
   * @return offset in {@code [0, textLength]}
   */
  public static int hitTestToOffset(
      final float px,
      final float py,
      final LayoutMap layoutMap,
      final float horizontalPadding,
      final float verticalPadding,
      final int textLength) {
    Validate.notNull(layoutMap, "layoutMap must not be null");
    Validate.isTrue(textLength >= 0, "textLength must be non-negative");
    float x = px - horizontalPadding;
    float y = py - verticalPadding;

    NodeLayoutEntry hit = layoutMap.hitTest(x, y);
    if (hit == null) {
      return nearestEndpoint(layoutMap.entries(), x, y, textLength);
    }
    SourceRange range = hit.range();
    if (range == null) {
      return textLength;
    }

    if (ChildRegions.isCompound(hit.node())) {
      ChildVisualRegion region = regionAtPoint(hit, x - hit.relX(), y - hit.relY());
      if (region != null) {
        SourceRange child = region.childRange();
        float ratio = region.horizontalRatio(x - hit.relX());
        int offset = child.start() + Math.min(Math.round(ratio * child.length()), child.length());
        return clamp(offset, textLength);
      }
    }

    float ratio = hit.width() <= 0f ? 0f : Math.max(0f, Math.min(1f, (x - hit.relX()) / hit.width()));
    return clamp(range.start() + Math.round(ratio * range.length()), textLength);
  }

  private static NodeLayoutEntry findCompoundEntryContaining(List<NodeLayoutEntry> entries, int offset) {
    NodeLayoutEntry best = null;
    for (NodeLayoutEntry entry : entries) {
      SourceRange range = entry.range();
      if (range != null
          && ChildRegions.isCompound(entry.node())
          && range.containsInclusive(offset)
          && (best == null || range.length() < best.range().length())) {
        best = entry;
      }
    }
    return best;
  }

  private static Optional<CursorPosition> resolveCompound(
      NodeLayoutEntry entry, int offset, float horizontalPadding, float verticalPadding) {
    return ChildRegions.regionFor(entry, offset).map(region -> {
      SourceRange child = region.childRange();
      float ratio = ratio(offset - child.start(), child.length());
      return new CursorPosition(
          entry.relX() + region.xStart() + (region.xEnd() - region.xStart()) * ratio + horizontalPadding,
          entry.relY() + region.yStart() + verticalPadding,
          region.yEnd() - region.yStart());
    });
  }

  private static ChildVisualRegion regionAtPoint(NodeLayoutEntry entry, float localX, float localY) {
    List<ChildVisualRegion> regions = ChildRegions.regions(entry);
    for (ChildVisualRegion region : regions) {
      if (region.containsPoint(localX, localY)) {
        return region;
      }
    }
    ChildVisualRegion nearest = null;
    float bestDistance = Float.MAX_VALUE;
    for (ChildVisualRegion region : regions) {
      float dx = localX - region.centerX();
      float dy = localY - region.centerY();
      float distance = dx * dx + dy * dy;
      if (distance < bestDistance) {
        bestDistance = distance;
        nearest = region;
      }
    }
    return nearest;
  }

  private static CursorPosition nearest(
      List<NodeLayoutEntry> entries, int offset, float horizontalPadding, float verticalPadding) {
    NodeLayoutEntry before = null;
    NodeLayoutEntry after = null;
    for (NodeLayoutEntry entry : entries) {
      SourceRange range = entry.range();
      if (range == null) {
        continue;
      }
      if (range.end() <= offset && (before == null || range.end() > before.range().end())) {
        before = entry;
      }
      if (range.start() > offset && (after == null || range.start() < after.range().start())) {
        after = entry;
      }
    }
    if (before != null) {
      return rightEdge(before, horizontalPadding, verticalPadding);
    }
    NodeLayoutEntry target = after != null ? after : entries.get(0);
    return new CursorPosition(
        target.relX() + horizontalPadding, target.relY() + verticalPadding, target.height());
  }

  private static int nearestEndpoint(List<NodeLayoutEntry> entries, float x, float y, int textLength) {
    NodeLayoutEntry nearest = null;
    float bestDistance = Float.MAX_VALUE;
    for (NodeLayoutEntry entry : entries) {
      if (entry.range() == null) {
        continue;
      }
      float dx = x - entry.centerX();
      float dy = y - entry.centerY();
      float distance = dx * dx + NEAREST_VERTICAL_WEIGHT * dy * dy;
      if (distance < bestDistance) {
        bestDistance = distance;
        nearest = entry;
      }
    }
    if (nearest == null) {
      return textLength;
    }
    SourceRange range = nearest.range();
    return clamp(x >= nearest.centerX() ? range.end() : range.start(), textLength);
  }

  private static CursorPosition rightEdge(NodeLayoutEntry entry, float horizontalPadding, float verticalPadding) {
    return new CursorPosition(entry.right() + horizontalPadding, entry.relY() + verticalPadding, entry.height());
  }

  private static float ratio(int position, int length) {
    if (length <= 0) {
      return 0f;
    }
    return Math.max(0f, Math.min(1f, (float) position / length));
  }

  private static int clamp(int offset, int textLength) {
    return Math.max(0, Math.min(textLength, offset));
  }
}
