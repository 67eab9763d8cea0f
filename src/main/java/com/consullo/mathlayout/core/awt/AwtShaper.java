package com.consullo.mathlayout.core.awt;

import com.consullo.mathlayout.core.FontFamily;
import com.consullo.mathlayout.core.FontSpec;
import com.consullo.mathlayout.core.GlyphBounds;
import com.consullo.mathlayout.core.ShapedText;
import com.consullo.mathlayout.core.Shaper;
import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;
import java.awt.font.TextAttribute;
import java.awt.font.TextLayout;
import java.awt.geom.Rectangle2D;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Shaper} backed by {@code java.awt} font metrics. Works headless.
 *
 * <p>
 * Each {@link FontFamily} handle maps to an AWT family name, by default one of the logical fonts
 * ({@code Serif}, {@code SansSerif}, {@code Monospaced}). Fonts loaded from raw bytes for precise
 * ink bounds are cached by content, failures included.
 * </p>
 *
 * @since 1.0
 */
public final class AwtShaper implements Shaper {

  private static final Logger LOGGER = LoggerFactory.getLogger(AwtShaper.class);

  private static final float REGULAR_WEIGHT = 400f;

  private final Map<FontFamily, String> familyNames;
  private final FontRenderContext fontRenderContext = new FontRenderContext(null, true, true);
  private final Map<ByteBuffer, Optional<Font>> loadedFonts = Collections.synchronizedMap(new HashMap<>());

  public AwtShaper() {
    this(defaultFamilyNames());
  }

  /**
   * @param familyNames AWT family name per handle; missing handles fall back to {@code Serif}
   */
  public AwtShaper(final Map<FontFamily, String> familyNames) {
    Validate.notNull(familyNames, "familyNames must not be null");
    this.familyNames = familyNames.isEmpty()
        ? new EnumMap<>(FontFamily.class)
        : new EnumMap<>(familyNames);
  }

  public static Map<FontFamily, String> defaultFamilyNames() {
    Map<FontFamily, String> names = new EnumMap<>(FontFamily.class);
    names.put(FontFamily.ROMAN, Font.SERIF);
    names.put(FontFamily.MATH_ITALIC, Font.SERIF);
    names.put(FontFamily.SYMBOL, Font.SERIF);
    names.put(FontFamily.EXTENSION, Font.SERIF);
    names.put(FontFamily.SANS_SERIF, Font.SANS_SERIF);
    names.put(FontFamily.MONOSPACE, Font.MONOSPACED);
    return names;
  }

  @Override
  public ShapedText shape(final String text, final FontSpec font) {
    Validate.notNull(text, "text must not be null");
    Validate.notNull(font, "font must not be null");
    final Font awtFont = toAwtFont(font);
    final LineMetrics metrics = awtFont.getLineMetrics(text.isEmpty() ? " " : text, fontRenderContext);
    final float ascent = metrics.getAscent();
    final float height = ascent + metrics.getDescent();
    final float width = text.isEmpty() ? 0f : new TextLayout(text, awtFont, fontRenderContext).getAdvance();
    return new ShapedText(text, font, width, height, ascent);
  }

  /**
   * Ink bounds of {@code text} drawn with the font in {@code fontBytes}.
   *
   * @return bounds, or empty when the bytes are not a loadable TrueType/OpenType font
   */
  @Override
  public Optional<GlyphBounds> glyphBounds(final String text, final FontSpec font, final byte[] fontBytes) {
    if (text == null || text.isEmpty() || fontBytes == null || fontBytes.length == 0) {
      return Optional.empty();
    }
    Optional<Font> base = loadedFonts.get(ByteBuffer.wrap(fontBytes));
    if (base == null) {
      final byte[] owned = fontBytes.clone();
      base = loadFont(owned);
      loadedFonts.put(ByteBuffer.wrap(owned), base);
    }
    if (base.isEmpty()) {
      return Optional.empty();
    }
    final Font sized = base.get().deriveFont(attributes(font, null));
    final Rectangle2D bounds = new TextLayout(text, sized, fontRenderContext).getBounds();
    if (bounds.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new GlyphBounds((float) -bounds.getY(), (float) bounds.getMaxY(), (float) bounds.getWidth()));
  }

  /**
   * AWT font for a request, also used by {@link AwtCanvas} to paint shaped runs.
   *
   * @param font font request
   * @return AWT font
   */
  public Font toAwtFont(final FontSpec font) {
    return new Font(attributes(font, familyNames.getOrDefault(font.family(), Font.SERIF)));
  }

  private static Map<TextAttribute, Object> attributes(FontSpec font, String family) {
    Map<TextAttribute, Object> attributes = new HashMap<>();
    if (family != null) {
      attributes.put(TextAttribute.FAMILY, family);
    }
    attributes.put(TextAttribute.SIZE, font.sizePx());
    attributes.put(TextAttribute.WEIGHT, font.weight() / REGULAR_WEIGHT * TextAttribute.WEIGHT_REGULAR);
    attributes.put(TextAttribute.POSTURE, font.italic() ? TextAttribute.POSTURE_OBLIQUE : TextAttribute.POSTURE_REGULAR);
    return attributes;
  }

  /** Failures are cached as empty so unreadable bytes are only parsed once. */
  private static Optional<Font> loadFont(byte[] bytes) {
    try {
      Font font = Font.createFont(Font.TRUETYPE_FONT, new ByteArrayInputStream(bytes));
      LOGGER.debug("loadFont: loaded '{}' from {} bytes", font.getFontName(), bytes.length);
      return Optional.of(font);
    } catch (FontFormatException | IOException e) {
      LOGGER.warn("loadFont: unable to load font from {} bytes, using estimated ink bounds: {}",
          bytes.length, e.getMessage());
      return Optional.empty();
    }
  }
}
