package com.consullo.mathlayout.core.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class NodeLists {

  private NodeLists() {
  }

  /**
   * Children list that skips absent optional nodes.
   */
  static List<MathNode> present(MathNode... nodes) {
    List<MathNode> out = new ArrayList<>(nodes.length);
    for (MathNode node : nodes) {
      if (node != null) {
        out.add(node);
      }
    }
    return Collections.unmodifiableList(out);
  }

  static List<MathNode> copy(List<MathNode> nodes) {
    if (nodes == null) {
      throw new IllegalArgumentException("children must not be null.");
    }
    return List.copyOf(nodes);
  }

  static List<List<MathNode>> copyRows(List<List<MathNode>> rows) {
    if (rows == null) {
      throw new IllegalArgumentException("rows must not be null.");
    }
    List<List<MathNode>> out = new ArrayList<>(rows.size());
    for (List<MathNode> row : rows) {
      out.add(copy(row));
    }
    return Collections.unmodifiableList(out);
  }

  static List<MathNode> flatten(List<List<MathNode>> rows) {
    List<MathNode> out = new ArrayList<>();
    for (List<MathNode> row : rows) {
      out.addAll(row);
    }
    return Collections.unmodifiableList(out);
  }
}
