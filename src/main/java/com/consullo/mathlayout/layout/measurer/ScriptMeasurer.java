package com.consullo.mathlayout.layout.measurer;

import com.consullo.mathlayout.core.NodeLayout;
import com.consullo.mathlayout.core.RenderContext;
import com.consullo.mathlayout.core.tree.AccentNode;
import com.consullo.mathlayout.core.tree.MathNode;
import com.consullo.mathlayout.core.tree.SubscriptNode;
import com.consullo.mathlayout.core.tree.SuperscriptNode;
import com.consullo.mathlayout.layout.MathConstants;
import com.consullo.mathlayout.layout.MeasureScope;

/**
 * Lays out {@code a^b} and {@code a_b}.
 *
 * <p>
 * Three shapes are recognised, in this order:
 * </p>
 * <ol>
 * <li>a caption on {@code \overbrace} / <code>&#92;underbrace</code>, centred above or below the brace;</li>
 * <li>{@code x_i^2} (a script whose base is a script of the other kind), both scripts sharing one
 * column;</li>
 * <li>a single script, raised or lowered next to its base.</li>
 * </ol>
 *
 * @since 1.0
 */
public final class ScriptMeasurer implements NodeMeasurer<MathNode> {

  @Override
  public NodeLayout measure(MathNode node, RenderContext context, MeasureScope scope) {
    final boolean isSuper;
    final MathNode base;
    final MathNode script;
    if (node instanceof SuperscriptNode) {
      SuperscriptNode sup = (SuperscriptNode) node;
      isSuper = true;
      base = sup.base();
      script = sup.exponent();
    } else if (node instanceof SubscriptNode) {
      SubscriptNode sub = (SubscriptNode) node;
      isSuper = false;
      base = sub.base();
      script = sub.index();
    } else {
      throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    if (base instanceof AccentNode && isBraceCaption(isSuper, (AccentNode) base)) {
      return measureBraceCaption((AccentNode) base, script, context, scope);
    }
    if (isSuper && base instanceof SubscriptNode) {
      SubscriptNode inner = (SubscriptNode) base;
      return measureBoth(inner.base(), script, inner.index(), context, scope);
    }
    if (!isSuper && base instanceof SuperscriptNode) {
      SuperscriptNode inner = (SuperscriptNode) base;
      return measureBoth(inner.base(), inner.exponent(), script, context, scope);
    }
    return measureSingle(isSuper, base, script, context, scope);
  }

  private static boolean isBraceCaption(boolean isSuper, AccentNode accent) {
    return isSuper ? accent.kind() == AccentNode.Kind.OVERBRACE : accent.kind() == AccentNode.Kind.UNDERBRACE;
  }

  private NodeLayout measureBraceCaption(
      AccentNode brace, MathNode caption, RenderContext context, MeasureScope scope) {
    final NodeLayout braceLayout = scope.measure(brace, context);
    final NodeLayout captionLayout = scope.measure(caption, context.toScriptStyle());
    final float gap = context.getFontSizePx() * MathConstants.BRACE_ANNOTATION_GAP;
    final float width = Math.max(braceLayout.width(), captionLayout.width());
    final float height = braceLayout.height() + gap + captionLayout.height();
    final float braceX = (width - braceLayout.width()) / 2f;
    final float captionX = (width - captionLayout.width()) / 2f;

    if (brace.kind().isUnder()) {
      return new NodeLayout(width, height, braceLayout.baseline(), (canvas, x, y) -> {
        braceLayout.draw(canvas, x + braceX, y);
        captionLayout.draw(canvas, x + captionX, y + braceLayout.height() + gap);
      });
    }
    final float braceTop = captionLayout.height() + gap;
    return new NodeLayout(width, height, braceTop + braceLayout.baseline(), (canvas, x, y) -> {
      captionLayout.draw(canvas, x + captionX, y);
      braceLayout.draw(canvas, x + braceX, y + braceTop);
    });
  }

  private NodeLayout measureBoth(
      MathNode base, MathNode superscript, MathNode subscript, RenderContext context, MeasureScope scope) {
    final RenderContext scriptStyle = context.toScriptStyle();
    final NodeLayout baseLayout = scope.measure(base, context);
    final NodeLayout supLayout = scope.measure(superscript, scriptStyle);
    final NodeLayout subLayout = scope.measure(subscript, scriptStyle);

    final float scriptX = baseLayout.width() + ScriptShifts.kern(context);
    final float supRelY = ScriptShifts.relativeY(true, context);
    final float subRelY = ScriptShifts.relativeY(false, context);

    final float top = Math.min(-baseLayout.baseline(),
        Math.min(supRelY - supLayout.baseline(), subRelY - subLayout.baseline()));
    final float bottom = Math.max(baseLayout.descent(),
        Math.max(supRelY + supLayout.descent(), subRelY + subLayout.descent()));
    final float baseline = -top;
    final float width = scriptX + Math.max(supLayout.width(), subLayout.width());

    return new NodeLayout(width, bottom - top, baseline, (canvas, x, y) -> {
      baseLayout.draw(canvas, x, y + baseline - baseLayout.baseline());
      supLayout.draw(canvas, x + scriptX, y + baseline + supRelY - supLayout.baseline());
      subLayout.draw(canvas, x + scriptX, y + baseline + subRelY - subLayout.baseline());
    });
  }

  private NodeLayout measureSingle(
      boolean isSuper, MathNode base, MathNode script, RenderContext context, MeasureScope scope) {
    final NodeLayout baseLayout = scope.measure(base, context);
    final NodeLayout scriptLayout = scope.measure(script, context.toScriptStyle());

    final float scriptX = baseLayout.width() + ScriptShifts.kern(context);
    final float relY = ScriptShifts.relativeY(isSuper, context);

    final float top = Math.min(-baseLayout.baseline(), relY - scriptLayout.baseline());
    final float bottom = Math.max(baseLayout.descent(), relY + scriptLayout.descent());
    final float baseline = -top;
    final float width = scriptX + scriptLayout.width();

    return new NodeLayout(width, bottom - top, baseline, (canvas, x, y) -> {
      baseLayout.draw(canvas, x, y + baseline - baseLayout.baseline());
      scriptLayout.draw(canvas, x + scriptX, y + baseline + relY - scriptLayout.baseline());
    });
  }
}
