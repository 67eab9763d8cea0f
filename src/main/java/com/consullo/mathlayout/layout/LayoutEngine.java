package com.consullo.mathlayout.layout;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.MathStyle;
import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.Shaper;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.core.tree.AlignedNode;
import com.consullo.mathlayout.core.tree.BigOperatorNode;
import com.consullo.mathlayout.core.tree.BinomialNode;
import com.consullo.mathlayout.core.tree.BoxedNode;
import com.consullo.mathlayout.core.tree.CasesNode;
import com.consullo.mathlayout.core.tree.ColorNode;
import com.consullo.mathlayout.core.tree.DelimitedNode;
import com.consullo.mathlayout.core.tree.DocumentNode;
import com.consullo.mathlayout.core.tree.ExtensibleArrowNode;
import com.consullo.mathlayout.core.tree.FractionNode;
import com.consullo.mathlayout.core.tree.GroupNode;
import com.consullo.mathlayout.core.tree.HSpaceNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.MathNodeVisitor;
import com.consullo.mathlayout.core.tree.MathStyleNode;
import com.consullo.mathlayout.core.tree.MatrixNode;
import com.consullo.mathlayout.core.tree.MultlineNode;
import com.consullo.mathlayout.core.tree.NewLineNode;
import com.consullo.mathlayout.core.tree.OperatorNode;
import com.consullo.mathlayout.core.tree.PhantomNode;
import com.consullo.mathlayout.core.tree.RootNode;
import com.consullo.mathlayout.core.tree.SideSetNode;
import com.consullo.mathlayout.core.tree.SizedDelimiterNode;
import com.consullo.mathlayout.core.tree.SmashNode;
import com.consullo.mathlayout.core.tree.SpaceNode;
import com.consullo.mathlayout.core.tree.StackNode;
import com.consullo.mathlayout.core.tree.StyleNode;
import com.consullo.mathlayout.core.tree.SubscriptNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.core.tree.SymbolNode;
import com.consullo.mathlayout.core.tree.TensorNode;
import com.consullo.mathlayout.core.tree.TextModeNode;
import com.consullo.mathlayout.core.tree.TextNode;
import com.consullo.mathlayout.layout.measurer.AccentMeasurer;
import com.consullo.mathlayout.layout.measurer.BigOperatorMeasurer;
import com.consullo.mathlayout.layout.measurer.BinomialMeasurer;
import com.consullo.mathlayout.layout.measurer.DelimiterMeasurer;
import com.consullo.mathlayout.layout.measurer.ExtensibleArrowMeasurer;
import com.consullo.mathlayout.layout.measurer.FractionMeasurer;
import com.consullo.mathlayout.layout.measurer.IndexedScriptMeasurer;
import com.consullo.mathlayout.layout.measurer.MatrixMeasurer;
import com.consullo.mathlayout.layout.measurer.RootMeasurer;
import com.consullo.mathlayout.layout.measurer.ScriptMeasurer;
import com.consullo.mathlayout.layout.measurer.SpecialEffectMeasurer;
import com.consullo.mathlayout.layout.measurer.StackMeasurer;
import com.consullo.mathlayout.layout.measurer.TextContentMeasurer;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an expression tree into a {@link NodeLayout}.
 *
 * <p>
 * Strategy:
 * <ul>
 * <li>Each node kind is dispatched to its construct measurer, which calls back through
 * {@link MeasureScope} for its children (bottom-up).</li>
 * <li>Sibling sequences are aligned on a common baseline with TeX inter-atom spacing.</li>
 * <li>In display style, integrals are re-measured to the height of the content on their right.</li>
 * <li>Explicit line breaks stack lines left-aligned.</li>
 * <li>When a {@link LayoutMap} is supplied, the boxes of the top-level sequence are recorded for
 * cursor placement and hit-testing.</li>
 * </ul>
 * </p>
 *
 * <p>
 * The engine holds no per-pass state and may be shared; the {@link LayoutMap} it writes may not.
 * </p>
 *
 * @since 1.0
 */
public final class LayoutEngine implements MeasureScope {

  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutEngine.class);

  private static final int BOLD_WEIGHT = 700;

  private final Shaper shaper;
  private final LayoutEngineConfig config;
  private final Dispatcher dispatcher = new Dispatcher();

  private final TextContentMeasurer textMeasurer = new TextContentMeasurer();
  private final FractionMeasurer fractionMeasurer = new FractionMeasurer();
  private final RootMeasurer rootMeasurer = new RootMeasurer();
  private final ScriptMeasurer scriptMeasurer = new ScriptMeasurer();
  private final BigOperatorMeasurer bigOperatorMeasurer;
  private final AccentMeasurer accentMeasurer = new AccentMeasurer();
  private final BinomialMeasurer binomialMeasurer = new BinomialMeasurer();
  private final DelimiterMeasurer delimiterMeasurer = new DelimiterMeasurer();
  private final StackMeasurer stackMeasurer = new StackMeasurer();
  private final ExtensibleArrowMeasurer arrowMeasurer = new ExtensibleArrowMeasurer();
  private final SpecialEffectMeasurer specialEffectMeasurer = new SpecialEffectMeasurer();
  private final IndexedScriptMeasurer indexedScriptMeasurer = new IndexedScriptMeasurer();
  private final MatrixMeasurer matrixMeasurer = new MatrixMeasurer();

  public LayoutEngine(Shaper shaper, LayoutEngineConfig config) {
    if (shaper == null || config == null) {
      throw new IllegalArgumentException("shaper/config must not be null.");
    }
    this.shaper = shaper;
    this.config = config;
    this.bigOperatorMeasurer = new BigOperatorMeasurer(config.stretchIntegrals());
  }

  public LayoutEngineConfig config() {
    return config;
  }

  @Override
  public Shaper shaper() {
    return shaper;
  }

  /**
   * Measure a single node with the given style.
   *
   * @param node node
   * @param context style
   * @return layout
   * @throws IllegalStateException if the node kind has no measurer
   */
  @Override
  public NodeLayout measure(final MathNode node, final RenderContext context) {
    Validate.notNull(node, "node must not be null");
    Validate.notNull(context, "context must not be null");
    NodeLayout layout = node.accept(dispatcher, context);
    if (layout == null) {
      throw new IllegalStateException("No layout produced for node type: " + node.getClass().getSimpleName());
    }
    return layout;
  }

  /**
   * Measure a whole tree and record the boxes of its top-level sequence.
   *
   * <p>
   * The map is cleared first. A {@link GroupNode} or {@link DocumentNode} root contributes its
   * children as the sequence; any other root is a sequence of one.
   * </p>
   *
   * @param root tree root
   * @param context style
   * @param layoutMap map to refill
   * @return layout of the whole tree
   */
  public NodeLayout measure(final MathNode root, final RenderContext context, final LayoutMap layoutMap) {
    Validate.notNull(root, "root must not be null");
    Validate.notNull(layoutMap, "layoutMap must not be null");
    layoutMap.clear();
    List<MathNode> sequence;
    if (root instanceof GroupNode) {
      sequence = ((GroupNode) root).children();
    } else if (root instanceof DocumentNode) {
      sequence = ((DocumentNode) root).children();
    } else {
      sequence = List.of(root);
    }
    NodeLayout layout = layoutSequence(sequence, context, layoutMap);
    LOGGER.debug("measure: {} top-level children, {} entries, width={}, height={}",
        sequence.size(), layoutMap.size(), layout.width(), layout.height());
    return layout;
  }

  @Override
  public NodeLayout measureGroup(final List<MathNode> nodes, final RenderContext context) {
    return layoutSequence(nodes, context, null);
  }

  /**
   * Measure a sibling sequence, recording one entry per sibling.
   *
   * @param nodes siblings
   * @param context style
   * @param layoutMap map to append to, may be null
   * @return layout of the sequence
   */
  public NodeLayout measureGroup(final List<MathNode> nodes, final RenderContext context, final LayoutMap layoutMap) {
    return layoutSequence(nodes, context, layoutMap);
  }

  @Override
  public float axisHeight(final RenderContext context) {
    return MathAxis.axisHeight(context, shaper);
  }

  private NodeLayout layoutSequence(List<MathNode> nodes, RenderContext context, LayoutMap layoutMap) {
    Validate.notNull(nodes, "nodes must not be null");
    Validate.notNull(context, "context must not be null");
    // A height hint targets one integral, never the siblings it was computed from.
    RenderContext style = context.getBigOpHeightHint() == null ? context : context.withBigOpHeightHint(null);

    List<List<MathNode>> lines = splitLines(nodes);
    if (lines.size() == 1) {
      Row row = layoutRow(lines.get(0), style);
      row.record(layoutMap, 0f);
      return row.toLayout();
    }

    // Step A: measure every line on its own
    List<Row> rows = new ArrayList<>(lines.size());
    for (List<MathNode> line : lines) {
      rows.add(layoutRow(line, style));
    }

    // Step B: stack left-aligned
    final float spacing = style.getFontSizePx() * config.lineSpacingRatio();
    final float[] tops = new float[rows.size()];
    float width = 0f;
    float y = 0f;
    for (int i = 0; i < rows.size(); i++) {
      Row row = rows.get(i);
      tops[i] = y;
      row.record(layoutMap, y);
      width = Math.max(width, row.width);
      y += row.height + spacing;
    }
    final float height = y - spacing;
    final List<NodeLayout> lineLayouts = new ArrayList<>(rows.size());
    for (Row row : rows) {
      lineLayouts.add(row.toLayout());
    }
    return new NodeLayout(width, height, rows.get(0).baseline, (canvas, x, top) -> {
      for (int i = 0; i < lineLayouts.size(); i++) {
        lineLayouts.get(i).draw(canvas, x, top + tops[i]);
      }
    });
  }

  /**
   * Splits on {@link NewLineNode}. A trailing empty line is dropped; there is always at least one
   * line.
   */
  static List<List<MathNode>> splitLines(List<MathNode> nodes) {
    List<List<MathNode>> lines = new ArrayList<>();
    List<MathNode> current = new ArrayList<>();
    for (MathNode node : nodes) {
      if (node instanceof NewLineNode) {
        lines.add(current);
        current = new ArrayList<>();
      } else {
        current.add(node);
      }
    }
    if (!current.isEmpty() || lines.isEmpty()) {
      lines.add(current);
    }
    return lines;
  }

  private Row layoutRow(List<MathNode> nodes, RenderContext context) {
    final int count = nodes.size();
    final List<NodeLayout> layouts = new ArrayList<>(count);
    for (MathNode node : nodes) {
      layouts.add(measure(node, context));
    }

    if (config.stretchIntegrals() && context.getMathStyle() == MathStyle.DISPLAY) {
      for (int i = 0; i < count; i++) {
        MathNode node = nodes.get(i);
        if (node instanceof BigOperatorNode && ((BigOperatorNode) node).isIntegral()) {
          float hint = rightEnvelope(nodes, layouts, i);
          if (hint > 0f) {
            layouts.set(i, measure(node, context.withBigOpHeightHint(hint)));
          }
        }
      }
    }

    final boolean isScript = context.getMathStyle().isScript();
    final float fontSize = context.getFontSizePx();
    final float[] offsets = new float[count];
    float x = 0f;
    float ascent = 0f;
    float descent = 0f;
    for (int i = 0; i < count; i++) {
      NodeLayout layout = layouts.get(i);
      if (i > 0) {
        x += gapBetween(nodes.get(i - 1), nodes.get(i), isScript) * fontSize;
      }
      offsets[i] = x;
      x += layout.width();
      ascent = Math.max(ascent, layout.ascent());
      descent = Math.max(descent, layout.descent());
    }
    return new Row(nodes, layouts, offsets, x, ascent + descent, ascent);
  }

  /** Ascent plus descent of the siblings right of an integral, up to the next big operator. */
  private static float rightEnvelope(List<MathNode> nodes, List<NodeLayout> layouts, int index) {
    float ascent = 0f;
    float descent = 0f;
    for (int j = index + 1; j < nodes.size(); j++) {
      MathNode right = nodes.get(j);
      if (right instanceof BigOperatorNode) {
        break;
      }
      if (isSpace(right)) {
        continue;
      }
      ascent = Math.max(ascent, layouts.get(j).ascent());
      descent = Math.max(descent, layouts.get(j).descent());
    }
    return ascent + descent;
  }

  private static float gapBetween(MathNode left, MathNode right, boolean isScript) {
    if (isSpace(left) || isSpace(right)) {
      return 0f;
    }
    return MathSpacing.spaceBetween(MathSpacing.classify(left), MathSpacing.classify(right), isScript).emFactor();
  }

  private static boolean isSpace(MathNode node) {
    return node instanceof SpaceNode || node instanceof HSpaceNode;
  }

  static RenderContext applyVariant(RenderContext context, StyleNode.Variant variant) {
    switch (variant) {
      case BOLD:
      case BLACKBOARD_BOLD:
        return context.withFontWeight(BOLD_WEIGHT);
      case ITALIC:
        return context.withItalic(true);
      case ROMAN:
        return context.toBuilder().fontFamily(FontFamily.ROMAN).italic(false).build();
      case SANS_SERIF:
        return context.toBuilder().fontFamily(FontFamily.SANS_SERIF).italic(false).build();
      case MONOSPACE:
        return context.toBuilder().fontFamily(FontFamily.MONOSPACE).italic(false).build();
      default:
        throw new IllegalStateException("Unknown variant: " + variant);
    }
  }

  /**
   * One baseline-aligned line of siblings.
   */
  private static final class Row {
    final List<MathNode> nodes;
    final List<NodeLayout> layouts;
    final float[] offsets;
    final float width;
    final float height;
    final float baseline;

    Row(List<MathNode> nodes, List<NodeLayout> layouts, float[] offsets, float width, float height, float baseline) {
      this.nodes = nodes;
      this.layouts = List.copyOf(layouts);
      this.offsets = offsets;
      this.width = width;
      this.height = height;
      this.baseline = baseline;
    }

    void record(LayoutMap layoutMap, float top) {
      if (layoutMap == null) {
        return;
      }
      for (int i = 0; i < layouts.size(); i++) {
        NodeLayout layout = layouts.get(i);
        layoutMap.add(new NodeLayoutEntry(nodes.get(i), offsets[i], top + baseline - layout.baseline(),
            layout.width(), layout.height(), layout.baseline()));
      }
    }

    NodeLayout toLayout() {
      return new NodeLayout(width, height, baseline, (canvas, x, y) -> {
        for (int i = 0; i < layouts.size(); i++) {
          NodeLayout child = layouts.get(i);
          child.draw(canvas, x + offsets[i], y + baseline - child.baseline());
        }
      });
    }
  }

  /**
   * Routes each node kind to its measurer. Containers are handled here since they only adjust the
   * style and measure their children as a sequence.
   */
  private final class Dispatcher implements MathNodeVisitor<NodeLayout, RenderContext> {

    @Override
    public NodeLayout visitText(TextNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitTextMode(TextModeNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSymbol(SymbolNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitOperator(OperatorNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSpace(SpaceNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitHSpace(HSpaceNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitNewLine(NewLineNode node, RenderContext context) {
      return textMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitGroup(GroupNode node, RenderContext context) {
      return measureGroup(node.children(), context);
    }

    @Override
    public NodeLayout visitDocument(DocumentNode node, RenderContext context) {
      return measureGroup(node.children(), context);
    }

    @Override
    public NodeLayout visitStyle(StyleNode node, RenderContext context) {
      return measureGroup(node.content(), applyVariant(context, node.variant()));
    }

    @Override
    public NodeLayout visitColor(ColorNode node, RenderContext context) {
      return measureGroup(node.content(), context.withColor(node.argb()));
    }

    @Override
    public NodeLayout visitMathStyle(MathStyleNode node, RenderContext context) {
      return measureGroup(node.content(), context.withMathStyle(node.level()));
    }

    @Override
    public NodeLayout visitFraction(FractionNode node, RenderContext context) {
      return fractionMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitRoot(RootNode node, RenderContext context) {
      return rootMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSuperscript(SuperscriptNode node, RenderContext context) {
      return scriptMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSubscript(SubscriptNode node, RenderContext context) {
      return scriptMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitBigOperator(BigOperatorNode node, RenderContext context) {
      return bigOperatorMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitAccent(AccentNode node, RenderContext context) {
      return accentMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitBinomial(BinomialNode node, RenderContext context) {
      return binomialMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitDelimited(DelimitedNode node, RenderContext context) {
      return delimiterMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSizedDelimiter(SizedDelimiterNode node, RenderContext context) {
      return delimiterMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitStack(StackNode node, RenderContext context) {
      return stackMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitExtensibleArrow(ExtensibleArrowNode node, RenderContext context) {
      return arrowMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitBoxed(BoxedNode node, RenderContext context) {
      return specialEffectMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitPhantom(PhantomNode node, RenderContext context) {
      return specialEffectMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSmash(SmashNode node, RenderContext context) {
      return specialEffectMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitSideSet(SideSetNode node, RenderContext context) {
      return indexedScriptMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitTensor(TensorNode node, RenderContext context) {
      return indexedScriptMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitMatrix(MatrixNode node, RenderContext context) {
      return matrixMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitCases(CasesNode node, RenderContext context) {
      return matrixMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitAligned(AlignedNode node, RenderContext context) {
      return matrixMeasurer.measure(node, context, LayoutEngine.this);
    }

    @Override
    public NodeLayout visitMultline(MultlineNode node, RenderContext context) {
      return matrixMeasurer.measure(node, context, LayoutEngine.this);
    }
  }
}
