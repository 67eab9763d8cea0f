package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.MathNode;

/**
 * Position of one laid-out node relative to the content origin of a measurement pass.
 *
 * @param node laid-out node
 * @param relX left edge
 * @param relY top edge
 * @param width box width
 * @param height box height
 * @param baseline baseline measured from the top edge
 * @since 1.0
 */
public record NodeLayoutEntry(MathNode node, float relX, float relY, float width, float height, float baseline) {

  public NodeLayoutEntry {
    if (node == null) {
      throw new IllegalArgumentException("node must not be null.");
    }
  }

  /**
   * Source range of the node, or null when it has none.
   *
   * @return range
   */
  public SourceRange range() {
    return node.sourceRange();
  }

  public float right() {
    return relX + width;
  }

  public float bottom() {
    return relY + height;
  }

  public float centerX() {
    return relX + width / 2f;
  }

  public float centerY() {
    return relY + height / 2f;
  }

  public float area() {
    return width * height;
  }

  /**
   * Point containment with inclusive edges.
   *
   * @param x x coordinate
   * @param y y coordinate
   * @return true when the point is on or inside the box
   */
  public boolean containsPoint(float x, float y) {
    return x >= relX && x <= relX + width && y >= relY && y <= relY + height;
  }
}
