package com.consullo.mathlayout.editor;

import com.consullo.mathlayout.core.SourceRange;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.core.tree.DelimitedNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.core.tree.SimpleMathNodeVisitor;
import com.consullo.mathlayout.core.tree.StackNode;
import com.consullo.mathlayout.core.tree.SubscriptNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.layout.NodeLayoutEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Splits the box of a compound node into the regions of its editable children.
 *
 * <p>
 * The split is geometric rather than measured: a fraction's numerator owns the upper half of the
 * box, a superscript's exponent the upper right part, and so on. This keeps cursor placement
 * independent of how the measurers positioned the children, at the cost of being approximate for
 * unusual proportions.
 * </p>
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Regions are returned in lookup-priority order; the first one whose range contains an offset
 * wins.</li>
 * <li>Children without a source range produce no region.</li>
 * <li>A child's region carries its inner content range, so the braces of a group stay outside the
 * editable span.</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class ChildRegions {

  private static final float SCRIPT_LENGTH_WEIGHT = 0.7f;
  private static final float MIN_BASE_RATIO = 0.2f;
  private static final float MAX_BASE_RATIO = 0.9f;

  private static final RegionVisitor REGIONS = new RegionVisitor();

  private ChildRegions() {
  }

  /**
   * Whether the node is one of the constructs whose box is split into child regions.
   *
   * @param node node
   * @return true for fractions, scripts, roots, big operators, accents, binomials, stacks and
   *         delimited groups
   */
  public static boolean isCompound(final MathNode node) {
    return node instanceof FractionNode
        || node instanceof SuperscriptNode
        || node instanceof SubscriptNode
        || node instanceof RootNode
        || node instanceof BigOperatorNode
        || node instanceof AccentNode
        || node instanceof BinomialNode
        || node instanceof StackNode
        || node instanceof DelimitedNode;
  }

  /**
   * Editable range of a child.
   *
   * <p>For a group with children this is the span from the first child's start to the last
   * child's end. For an empty group of at least two characters it is the range between the
   * braces. Anything else answers its own range.</p>
   *
   * @param node child node, may be null
   * @return inner range, or null when none can be determined
   */
  public static SourceRange innerContentRange(final MathNode node) {
    if (node == null) {
      return null;
    }
    SourceRange range = node.sourceRange();
    if (!(node instanceof GroupNode)) {
      return range;
    }
    if (range == null) {
      return null;
    }
    List<MathNode> children = ((GroupNode) node).children();
    if (!children.isEmpty()) {
      SourceRange first = children.get(0).sourceRange();
      SourceRange last = children.get(children.size() - 1).sourceRange();
      if (first == null || last == null) {
        return null;
      }
      return new SourceRange(first.start(), Math.max(first.start(), last.end()));
    }
    if (range.length() >= 2) {
      return new SourceRange(range.start() + 1, range.end() - 1);
    }
    return range;
  }

  /**
   * Child regions of a compound entry in lookup-priority order.
   *
   * @param entry laid-out compound node
   * @return regions, empty for non-compound nodes
   */
  public static List<ChildVisualRegion> regions(final NodeLayoutEntry entry) {
    Validate.notNull(entry, "entry must not be null");
    return Collections.unmodifiableList(entry.node().accept(REGIONS, entry));
  }

  /**
   * First region whose range contains {@code offset} inclusively.
   *
   * @param entry laid-out compound node
   * @param offset source offset
   * @return region, or empty
   */
  public static Optional<ChildVisualRegion> regionFor(final NodeLayoutEntry entry, final int offset) {
    for (ChildVisualRegion region : regions(entry)) {
      if (region.childRange().containsInclusive(offset)) {
        return Optional.of(region);
      }
    }
    return Optional.empty();
  }

  static float scriptSplit(MathNode base, MathNode script, float width) {
    float baseLen = lengthOrOne(innerContentRange(base));
    float scriptLen = lengthOrOne(innerContentRange(script));
    float ratio = baseLen / (baseLen + scriptLen * SCRIPT_LENGTH_WEIGHT);
    return width * Math.max(MIN_BASE_RATIO, Math.min(MAX_BASE_RATIO, ratio));
  }

  private static float lengthOrOne(SourceRange range) {
    return range == null ? 1f : range.length();
  }

  private static void addRegion(
      List<ChildVisualRegion> out, MathNode child, float xStart, float xEnd, float yStart, float yEnd) {
    SourceRange range = innerContentRange(child);
    if (range != null) {
      out.add(new ChildVisualRegion(range, xStart, xEnd, yStart, yEnd));
    }
  }

  private static final class RegionVisitor
      extends SimpleMathNodeVisitor<List<ChildVisualRegion>, NodeLayoutEntry> {

    @Override
    protected List<ChildVisualRegion> defaultAction(MathNode node, NodeLayoutEntry entry) {
      return new ArrayList<>();
    }

    @Override
    public List<ChildVisualRegion> visitFraction(FractionNode node, NodeLayoutEntry entry) {
      return halves(node.numerator(), node.denominator(), entry);
    }

    @Override
    public List<ChildVisualRegion> visitBinomial(BinomialNode node, NodeLayoutEntry entry) {
      return halves(node.top(), node.bottom(), entry);
    }

    @Override
    public List<ChildVisualRegion> visitSuperscript(SuperscriptNode node, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      float bx = scriptSplit(node.base(), node.exponent(), w);
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.exponent(), bx, w, 0f, h * 0.6f);
      addRegion(out, node.base(), 0f, bx, 0f, h);
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitSubscript(SubscriptNode node, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      float bx = scriptSplit(node.base(), node.index(), w);
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.base(), 0f, bx, 0f, h);
      addRegion(out, node.index(), bx, w, h * 0.4f, h);
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitRoot(RootNode node, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.index(), 0f, w * 0.3f, 0f, h / 2f);
      addRegion(out, node.content(), w * 0.3f, w, 0f, h);
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitBigOperator(BigOperatorNode node, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.superscript(), 0f, w, 0f, h * 0.3f);
      addRegion(out, node.subscript(), 0f, w, h * 0.7f, h);
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitAccent(AccentNode node, NodeLayoutEntry entry) {
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.content(), 0f, entry.width(), 0f, entry.height());
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitStack(StackNode node, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, node.above(), 0f, w, 0f, h * 0.33f);
      addRegion(out, node.below(), 0f, w, h * 0.66f, h);
      addRegion(out, node.base(), 0f, w, h * 0.33f, h * 0.66f);
      return out;
    }

    @Override
    public List<ChildVisualRegion> visitDelimited(DelimitedNode node, NodeLayoutEntry entry) {
      List<ChildVisualRegion> out = new ArrayList<>();
      SourceRange merged = null;
      for (MathNode child : node.content()) {
        SourceRange range = innerContentRange(child);
        if (range != null) {
          merged = merged == null ? range : merged.merge(range);
        }
      }
      if (merged != null) {
        out.add(new ChildVisualRegion(merged, 0f, entry.width(), 0f, entry.height()));
      }
      return out;
    }

    private static List<ChildVisualRegion> halves(MathNode upper, MathNode lower, NodeLayoutEntry entry) {
      float w = entry.width();
      float h = entry.height();
      List<ChildVisualRegion> out = new ArrayList<>();
      addRegion(out, upper, 0f, w, 0f, h / 2f);
      addRegion(out, lower, 0f, w, h / 2f, h);
      return out;
    }
  }
}
