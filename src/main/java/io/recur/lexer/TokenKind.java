package io.recur.lexer;

/** The types of tokens in RRULE text. */
public enum TokenKind {
  /** A part name or value: letters, digits and signs, e.g. {@code FREQ}, {@code -1FR}. */
  WORD,
  /** The {@code =} between a part name and its value. */
  EQUALS,
  /** The {@code ;} between parts. */
  SEMICOLON,
  /** The {@code ,} between list values. */
  COMMA,
  /** A {@code :} as found in a property-prefixed line such as {@code RRULE:FREQ=DAILY}. */
  COLON
}
