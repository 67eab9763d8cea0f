package com.consullo.mathlayout.core;

/**
 * Font family handles understood by a {@link Shaper}. Backends map each handle to a concrete
 * font.
 *
 * @since 1.0
 */
public enum FontFamily {
  ROMAN,
  MATH_ITALIC,
  SYMBOL,
  EXTENSION,
  SANS_SERIF,
  MONOSPACE
}
