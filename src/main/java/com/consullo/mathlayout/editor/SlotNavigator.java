package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.core.tree.AlignedNode;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.core.tree.CasesNode;
import com.consullo.mathlayout.core.tree.ExtensibleArrowNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.MatrixNode;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.core.tree.SideSetNode;
import com.consullo.mathlayout.core.tree.SimpleMathNodeVisitor;
import com.consullo.mathlayout.core.tree.SourceMapper;
import com.consullo.mathlayout.core.tree.StackNode;
import com.consullo.mathlayout.core.tree.SubscriptNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.TensorNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the caret to the next input slot of the innermost enclosing compound construct.
 *
 * <p>
 * After inserting {@code \frac{}{}} the caret sits in the numerator; repeated calls step to the
 * denominator and then past the fraction. A slot is the child a user fills in, in typing order.
 * </p>
 *
 * @since 1.0
 */
public final class SlotNavigator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SlotNavigator.class);

  private static final SlotVisitor SLOTS = new SlotVisitor();

  private SlotNavigator() {
  }

  /**
   * Offset of the slot following the one holding {@code offset}.
   *
   * @param offset caret offset
   * @param tree parsed tree
   * @return next slot's content start, the construct's end when already in its last slot, or
   *         empty when no enclosing construct has slots
   */
  public static OptionalInt nextSlotOffset(final int offset, final MathNode tree) {
    Validate.notNull(tree, "tree must not be null");
    List<MathNode> path = SourceMapper.nodePathAt(tree, offset);
    for (int i = path.size() - 1; i >= 0; i--) {
      MathNode node = path.get(i);
      List<MathNode> slots = orderedSlots(node);
      SourceRange nodeRange = node.sourceRange();
      if (slots.isEmpty() || nodeRange == null) {
        continue;
      }
      int current = currentSlot(offset, slots);
      if (current >= 0 && current < slots.size() - 1) {
        int next = slotContentStart(slots.get(current + 1), nodeRange);
        LOGGER.debug("nextSlotOffset: {} -> slot {} at {}", offset, current + 1, next);
        return OptionalInt.of(next);
      }
      return OptionalInt.of(nodeRange.end());
    }
    return OptionalInt.empty();
  }

  /**
   * Slots of a node in typing order; absent optional children are skipped.
   *
   * @param node node
   * @return slots, empty when the node has none
   */
  static List<MathNode> orderedSlots(final MathNode node) {
    return Collections.unmodifiableList(node.accept(SLOTS, null));
  }

  private static int currentSlot(int offset, List<MathNode> slots) {
    for (int i = 0; i < slots.size(); i++) {
      SourceRange range = slots.get(i).sourceRange();
      // a caret on the closing brace still belongs to the slot
      if (range != null && range.containsInclusive(offset)) {
        return i;
      }
    }
    return -1;
  }

  private static int slotContentStart(MathNode slot, SourceRange fallback) {
    SourceRange range = slot.sourceRange();
    if (range == null) {
      return fallback.end();
    }
    return slot instanceof GroupNode ? range.start() + 1 : range.start();
  }

  private static void addIfPresent(List<MathNode> out, MathNode node) {
    if (node != null) {
      out.add(node);
    }
  }

  private static final class SlotVisitor extends SimpleMathNodeVisitor<List<MathNode>, Void> {

    @Override
    protected List<MathNode> defaultAction(MathNode node, Void param) {
      return new ArrayList<>();
    }

    @Override
    public List<MathNode> visitFraction(FractionNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      out.add(node.numerator());
      out.add(node.denominator());
      return out;
    }

    @Override
    public List<MathNode> visitSuperscript(SuperscriptNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      out.add(node.exponent());
      return out;
    }

    @Override
    public List<MathNode> visitSubscript(SubscriptNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      out.add(node.index());
      return out;
    }

    @Override
    public List<MathNode> visitRoot(RootNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      addIfPresent(out, node.index());
      out.add(node.content());
      return out;
    }

    @Override
    public List<MathNode> visitBigOperator(BigOperatorNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      addIfPresent(out, node.subscript());
      addIfPresent(out, node.superscript());
      return out;
    }

    @Override
    public List<MathNode> visitBinomial(BinomialNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      out.add(node.top());
      out.add(node.bottom());
      return out;
    }

    @Override
    public List<MathNode> visitAccent(AccentNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      out.add(node.content());
      return out;
    }

    @Override
    public List<MathNode> visitStack(StackNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      addIfPresent(out, node.above());
      out.add(node.base());
      addIfPresent(out, node.below());
      return out;
    }

    @Override
    public List<MathNode> visitExtensibleArrow(ExtensibleArrowNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      addIfPresent(out, node.content());
      addIfPresent(out, node.below());
      return out;
    }

    @Override
    public List<MathNode> visitSideSet(SideSetNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      addIfPresent(out, node.leftSub());
      addIfPresent(out, node.leftSup());
      addIfPresent(out, node.rightSub());
      addIfPresent(out, node.rightSup());
      out.add(node.base());
      return out;
    }

    @Override
    public List<MathNode> visitTensor(TensorNode node, Void param) {
      List<MathNode> out = new ArrayList<>();
      for (TensorNode.Index index : node.indices()) {
        out.add(index.script());
      }
      return out;
    }

    // grid cells are visited row by row

    @Override
    public List<MathNode> visitMatrix(MatrixNode node, Void param) {
      return new ArrayList<>(node.children());
    }

    @Override
    public List<MathNode> visitCases(CasesNode node, Void param) {
      return new ArrayList<>(node.children());
    }

    @Override
    public List<MathNode> visitAligned(AlignedNode node, Void param) {
      return new ArrayList<>(node.children());
    }
  }
}
