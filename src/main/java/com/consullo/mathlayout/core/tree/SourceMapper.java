package com.consullo.mathlayout.core.tree;

import com.consullo.mathlayout.core.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Offset queries over a parsed tree.
 *
 * <p>
 * Lookups use half-open containment. Nodes without a source range are treated as transparent
 * containers: they never appear in a path themselves, but their children are still searched.
 * </p>
 *
 * @since 1.0
 */
public final class SourceMapper {

  private SourceMapper() {
  }

  /**
   * Nodes whose range contains {@code offset}, from the outermost down to the deepest.
   *
   * @param root tree root
   * @param offset source offset
   * @return enclosing path, empty when nothing contains the offset
   */
  public static List<MathNode> nodePathAt(final MathNode root, final int offset) {
    Validate.notNull(root, "root must not be null");
    final List<MathNode> path = new ArrayList<>();
    collectPath(root, offset, path);
    return Collections.unmodifiableList(path);
  }

  /**
   * Deepest node whose range contains {@code offset}.
   *
   * @param root tree root
   * @param offset source offset
   * @return deepest enclosing node, or null
   */
  public static MathNode leafNodeAt(final MathNode root, final int offset) {
    List<MathNode> path = nodePathAt(root, offset);
    return path.isEmpty() ? null : path.get(path.size() - 1);
  }

  /**
   * Ranged nodes without children, in document order.
   *
   * @param root tree root
   * @return leaves
   */
  public static List<MathNode> collectLeaves(final MathNode root) {
    Validate.notNull(root, "root must not be null");
    final List<MathNode> out = new ArrayList<>();
    collectLeaves(root, out);
    return Collections.unmodifiableList(out);
  }

  private static void collectPath(MathNode node, int offset, List<MathNode> path) {
    SourceRange range = node.sourceRange();
    if (range != null) {
      if (!range.contains(offset)) {
        return;
      }
      path.add(node);
    }
    for (MathNode child : node.children()) {
      int before = path.size();
      collectPath(child, offset, path);
      if (path.size() > before) {
        return;
      }
    }
  }

  private static void collectLeaves(MathNode node, List<MathNode> out) {
    List<MathNode> children = node.children();
    if (children.isEmpty()) {
      if (node.sourceRange() != null) {
        out.add(node);
      }
      return;
    }
    for (MathNode child : children) {
      collectLeaves(child, out);
    }
  }
}
