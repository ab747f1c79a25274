package io.recur.lexer;

import io.recur.Span;

/**
 * Represents a lexed token.
 *
 * @param kind the type of token
 * @param span the location in the input
 * @param text the exact source text of the token
 */
public record Token(TokenKind kind, Span span, String text) {
  /** Creates a word token. */
  public static Token word(String text, Span span) {
    return new Token(TokenKind.WORD, span, text);
  }

  /** Creates a punctuation token. */
  public static Token punct(TokenKind kind, Span span, char ch) {
    return new Token(kind, span, String.valueOf(ch));
  }
}
