package io.recur.lexer;

import io.recur.RecurException;
import io.recur.Span;
import java.util.ArrayList;
import java.util.List;

/** Tokenizes RRULE text into a list of tokens. */
public final class Lexer {
  private final String input;
  private int pos;

  private Lexer(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Tokenizes the input string into a list of tokens.
   *
   * @param input the input string to tokenize
   * @return a list of tokens
   * @throws RecurException if the input contains invalid characters
   */
  public static List<Token> tokenize(String input) throws RecurException {
    return new Lexer(input).doTokenize();
  }

  private List<Token> doTokenize() throws RecurException {
    List<Token> tokens = new ArrayList<>();
    while (pos < input.length()) {
      int start = pos;
      char ch = input.charAt(pos);

      TokenKind punct = punctuation(ch);
      if (punct != null) {
        pos++;
        tokens.add(Token.punct(punct, new Span(start, pos), ch));
        continue;
      }

      if (isWordChar(ch)) {
        while (pos < input.length() && isWordChar(input.charAt(pos))) {
          pos++;
        }
        tokens.add(Token.word(input.substring(start, pos), new Span(start, pos)));
        continue;
      }

      String shown = Character.isWhitespace(ch) ? "whitespace" : "character '" + ch + "'";
      throw RecurException.lex("unexpected " + shown, new Span(start, start + 1), input);
    }
    return tokens;
  }

  private static TokenKind punctuation(char c) {
    return switch (c) {
      case '=' -> TokenKind.EQUALS;
      case ';' -> TokenKind.SEMICOLON;
      case ',' -> TokenKind.COMMA;
      case ':' -> TokenKind.COLON;
      default -> null;
    };
  }

  private static boolean isWordChar(char c) {
    return (c >= 'A' && c <= 'Z')
        || (c >= 'a' && c <= 'z')
        || (c >= '0' && c <= '9')
        || c == '+'
        || c == '-';
  }
}
