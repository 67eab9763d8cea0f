package com.consullo.mathlayout.core;

import java.util.Arrays;
import java.util.Objects;
import org.apache.commons.lang3.Validate;

/**
 * Immutable style context passed top-down through a measurement pass.
 *
 * <p>
 * Every transformation returns a new instance, so a context can be shared between sibling
 * measurements and used as part of a memoization key. Font sizes are in pixels; {@code density}
 * converts the few device-independent constants (stroke widths, kerns) into pixels.
 * </p>
 *
 * @since 1.0
 */
public final class RenderContext {

  /** Size factor applied on top of the level change for numerators and denominators. */
  public static final float FRACTION_CHILD_SCALE = 0.9f;

  /** Size factor applied to big-operator limits. */
  public static final float LIMIT_SCALE = 0.7f;

  private final float fontSizePx;
  private final float density;
  private final int color;
  private final MathStyle mathStyle;
  private final FontFamily fontFamily;
  private final int fontWeight;
  private final boolean italic;
  private final byte[] extensionFontBytes;
  private final int extensionFontHash;
  private final Float bigOpHeightHint;

  private RenderContext(Builder b) {
    this.fontSizePx = b.fontSizePx;
    this.density = b.density;
    this.color = b.color;
    this.mathStyle = b.mathStyle;
    this.fontFamily = b.fontFamily;
    this.fontWeight = b.fontWeight;
    this.italic = b.italic;
    this.extensionFontBytes = b.extensionFontBytes;
    this.extensionFontHash = b.extensionFontHash;
    this.bigOpHeightHint = b.bigOpHeightHint;
  }

  public float getFontSizePx() {
    return fontSizePx;
  }

  public float getDensity() {
    return density;
  }

  public int getColor() {
    return color;
  }

  public MathStyle getMathStyle() {
    return mathStyle;
  }

  public FontFamily getFontFamily() {
    return fontFamily;
  }

  public int getFontWeight() {
    return fontWeight;
  }

  public boolean isItalic() {
    return italic;
  }

  /**
   * Raw bytes of the extension font used for precise ink measurement of large glyphs.
   *
   * @return copy of the font bytes, or null when not loaded
   */
  public byte[] getExtensionFontBytes() {
    return extensionFontBytes == null ? null : extensionFontBytes.clone();
  }

  /**
   * Target height for stretchable operators, set by the group orchestrator.
   *
   * @return height hint in pixels, or null
   */
  public Float getBigOpHeightHint() {
    return bigOpHeightHint;
  }

  /**
   * Converts device-independent units into pixels.
   *
   * @param dp value in dp
   * @return value in pixels
   */
  public float dp(float dp) {
    return dp * density;
  }

  /**
   * Font request for the current family, size, weight and slant.
   *
   * @return font spec
   */
  public FontSpec fontSpec() {
    return new FontSpec(fontFamily, fontSizePx, fontWeight, italic);
  }

  public RenderContext shrink(float factor) {
    return toBuilder().fontSizePx(fontSizePx * factor).build();
  }

  public RenderContext grow(float factor) {
    return toBuilder().fontSizePx(fontSizePx * factor).build();
  }

  /**
   * Context for super- and subscripts: one level down, with the font rescaled by the ratio of the
   * level scales.
   *
   * @return script context
   */
  public RenderContext toScriptStyle() {
    return withMathStyle(mathStyle.toScript());
  }

  /**
   * Context for numerators and denominators: one level down, then shrunk by
   * {@link #FRACTION_CHILD_SCALE}.
   *
   * @return fraction child context
   */
  public RenderContext toFractionChildStyle() {
    MathStyle next = mathStyle.toFractionChild();
    float size = fontSizePx * next.scale() / mathStyle.scale() * FRACTION_CHILD_SCALE;
    return toBuilder().mathStyle(next).fontSizePx(size).bigOpHeightHint(null).build();
  }

  /**
   * Context for big-operator limits.
   *
   * @return limit context
   */
  public RenderContext toLimitStyle() {
    return toBuilder()
        .mathStyle(mathStyle.toScript())
        .fontSizePx(fontSizePx * LIMIT_SCALE)
        .bigOpHeightHint(null)
        .build();
  }

  public RenderContext withMathStyle(MathStyle level) {
    Validate.notNull(level, "level must not be null");
    float size = fontSizePx * level.scale() / mathStyle.scale();
    return toBuilder().mathStyle(level).fontSizePx(size).bigOpHeightHint(null).build();
  }

  public RenderContext withColor(int argb) {
    return toBuilder().color(argb).build();
  }

  public RenderContext withFontFamily(FontFamily family) {
    return toBuilder().fontFamily(family).build();
  }

  public RenderContext withFontWeight(int weight) {
    return toBuilder().fontWeight(weight).build();
  }

  public RenderContext withItalic(boolean value) {
    return toBuilder().italic(value).build();
  }

  public RenderContext withBigOpHeightHint(Float hint) {
    return toBuilder().bigOpHeightHint(hint).build();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.fontSizePx = fontSizePx;
    b.density = density;
    b.color = color;
    b.mathStyle = mathStyle;
    b.fontFamily = fontFamily;
    b.fontWeight = fontWeight;
    b.italic = italic;
    // derived contexts share the array; it never escapes uncopied
    b.extensionFontBytes = extensionFontBytes;
    b.extensionFontHash = extensionFontHash;
    b.bigOpHeightHint = bigOpHeightHint;
    return b;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RenderContext)) {
      return false;
    }
    RenderContext that = (RenderContext) o;
    return Float.compare(that.fontSizePx, fontSizePx) == 0
        && Float.compare(that.density, density) == 0
        && color == that.color
        && fontWeight == that.fontWeight
        && italic == that.italic
        && mathStyle == that.mathStyle
        && fontFamily == that.fontFamily
        && extensionFontHash == that.extensionFontHash
        && Arrays.equals(extensionFontBytes, that.extensionFontBytes)
        && Objects.equals(bigOpHeightHint, that.bigOpHeightHint);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(fontSizePx, density, color, mathStyle, fontFamily, fontWeight, italic,
        bigOpHeightHint);
    return 31 * result + extensionFontHash;
  }

  @Override
  public String toString() {
    return "RenderContext{fontSizePx=" + fontSizePx
        + ", density=" + density
        + ", mathStyle=" + mathStyle
        + ", fontFamily=" + fontFamily
        + ", fontWeight=" + fontWeight
        + ", italic=" + italic
        + ", bigOpHeightHint=" + bigOpHeightHint
        + '}';
  }

  public static final class Builder {

    private float fontSizePx = 20f;
    private float density = 1f;
    private int color = 0xFF000000;
    private MathStyle mathStyle = MathStyle.TEXT;
    private FontFamily fontFamily = FontFamily.MATH_ITALIC;
    private int fontWeight = 400;
    private boolean italic = true;
    private byte[] extensionFontBytes;
    private int extensionFontHash;
    private Float bigOpHeightHint;

    private Builder() {
    }

    public Builder fontSizePx(float fontSizePx) {
      this.fontSizePx = fontSizePx;
      return this;
    }

    public Builder density(float density) {
      this.density = density;
      return this;
    }

    public Builder color(int argb) {
      this.color = argb;
      return this;
    }

    public Builder mathStyle(MathStyle mathStyle) {
      this.mathStyle = mathStyle;
      return this;
    }

    public Builder fontFamily(FontFamily fontFamily) {
      this.fontFamily = fontFamily;
      return this;
    }

    public Builder fontWeight(int fontWeight) {
      this.fontWeight = fontWeight;
      return this;
    }

    public Builder italic(boolean italic) {
      this.italic = italic;
      return this;
    }

    /**
     * @param bytes raw font file, copied; null clears it
     * @return this builder
     */
    public Builder extensionFontBytes(byte[] bytes) {
      this.extensionFontBytes = bytes == null ? null : bytes.clone();
      this.extensionFontHash = Arrays.hashCode(this.extensionFontBytes);
      return this;
    }

    public Builder bigOpHeightHint(Float hint) {
      this.bigOpHeightHint = hint;
      return this;
    }

    public RenderContext build() {
      if (!(fontSizePx > 0f)) {
        throw new IllegalArgumentException("fontSizePx must be positive.");
      }
      if (!(density > 0f)) {
        throw new IllegalArgumentException("density must be positive.");
      }
      if (mathStyle == null || fontFamily == null) {
        throw new IllegalArgumentException("mathStyle/fontFamily must not be null.");
      }
      if (fontWeight < 1 || fontWeight > 1000) {
        throw new IllegalArgumentException("fontWeight must be within 1..1000.");
      }
      return new RenderContext(this);
    }
  }
}
