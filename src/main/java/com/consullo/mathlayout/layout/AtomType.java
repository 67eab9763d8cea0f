package com.consullo.mathlayout.layout;

/**
 * TeX atom classes used to pick inter-atom spacing. The declaration order indexes the spacing
 * table in {@link MathSpacing}.
 *
 * @since 1.0
 */
public enum AtomType {
  /** Variables, digits, letters. */
  ORD,
  /** Large and named operators. */
  OP,
  /** Binary operators such as {@code +}. */
  BIN,
  /** Relations such as {@code =}. */
  REL,
  OPEN,
  CLOSE,
  PUNCT,
  /** Fractions and delimited subformulas. */
  INNER
}
