package com.consullo.mathlayout.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic shaper for tests: every character advances half the font size, the line box is
 * one font size tall and the baseline sits at 80% of it.
 *
 * @since 1.0
 */
public final class FixedMetricShaper implements Shaper {

  public static final float ADVANCE_RATIO = 0.5f;
  public static final float BASELINE_RATIO = 0.8f;

  private final List<FontSpec> requests = new ArrayList<>();

  @Override
  public ShapedText shape(final String text, final FontSpec font) {
    requests.add(font);
    final float size = font.sizePx();
    return new ShapedText(text, font, text.length() * size * ADVANCE_RATIO, size, size * BASELINE_RATIO);
  }

  /**
   * Font requests seen so far, in call order.
   *
   * @return requests
   */
  public List<FontSpec> requests() {
    return Collections.unmodifiableList(requests);
  }
}
