package io.recur.parser;

import io.recur.RecurException;
import io.recur.Span;
import io.recur.ast.Frequency;
import io.recur.ast.RecurrenceRule;
import io.recur.ast.RulePart;
import io.recur.ast.UntilSpec;
import io.recur.ast.Weekday;
import io.recur.ast.WeekdayNum;
import io.recur.lexer.Lexer;
import io.recur.lexer.Token;
import io.recur.lexer.TokenKind;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for RFC 5545 RRULE values ({@code FREQ=WEEKLY;BYDAY=MO;COUNT=3}).
 *
 * <p>Only syntax is checked here. Semantic constraints (terminators, ranges) are left to the
 * validator so that a syntactically well-formed rule can always be inspected and re-rendered.
 */
public final class Parser {
  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmss").withResolverStyle(ResolverStyle.STRICT);
  private static final Pattern WEEKDAY_NUM =
      Pattern.compile("([+-]?)(\\d{1,2})?([A-Za-z]{2})");

  private final String input;
  private final List<Token> tokens;
  private int pos;

  private Frequency frequency;
  private int interval = 1;
  private List<WeekdayNum> byWeekday;
  private List<Integer> byMonthDay;
  private List<Integer> byMonth;
  private UntilSpec until;
  private Integer count;
  private Weekday weekStart;
  private final List<RulePart> order = new ArrayList<>();

  private Parser(String input, List<Token> tokens) {
    this.input = input;
    this.tokens = tokens;
    this.pos = 0;
  }

  /**
   * Parses RRULE text into a RecurrenceRule.
   *
   * @param input the RRULE value, without the {@code RRULE:} property name
   * @return the parsed rule
   * @throws RecurException if the input is not well-formed
   */
  public static RecurrenceRule parse(String input) throws RecurException {
    if (input == null || input.isEmpty()) {
      throw RecurException.parse("empty input", new Span(0, 0), input, null);
    }

    List<Token> tokens = Lexer.tokenize(input);
    return new Parser(input, tokens).parseRule();
  }

  private RecurrenceRule parseRule() throws RecurException {
    rejectPropertyPrefix();

    while (true) {
      parsePart();
      Token tok = peek();
      if (tok == null) {
        break;
      }
      if (tok.kind() != TokenKind.SEMICOLON) {
        throw parseError("expected ';' between rule parts", tok.span());
      }
      pos++;
      if (peek() == null) {
        throw parseError("unexpected end of input after ';'", tok.span());
      }
    }

    if (frequency == null) {
      throw RecurException.parse(
          "missing FREQ part", new Span(0, input.length()), input, "FREQ=DAILY;" + input);
    }

    return new RecurrenceRule(
        frequency,
        interval,
        byWeekday,
        byMonthDay,
        byMonth,
        until,
        count,
        weekStart,
        Set.of(),
        order);
  }

  private void rejectPropertyPrefix() throws RecurException {
    if (tokens.size() >= 2
        && tokens.get(0).kind() == TokenKind.WORD
        && tokens.get(1).kind() == TokenKind.COLON) {
      Token name = tokens.get(0);
      Token colon = tokens.get(1);
      throw RecurException.parse(
          "unexpected property prefix '" + name.text() + ":'",
          new Span(name.span().start(), colon.span().end()),
          input,
          input.substring(colon.span().end()));
    }
  }

  private void parsePart() throws RecurException {
    Token nameTok = expect(TokenKind.WORD, "expected rule part name");
    RulePart part =
        RulePart.parse(nameTok.text())
            .orElseThrow(
                () ->
                    parseError("unsupported rule part '" + nameTok.text() + "'", nameTok.span()));
    if (order.contains(part)) {
      throw parseError("duplicate " + part + " part", nameTok.span());
    }
    expect(TokenKind.EQUALS, "expected '=' after " + part);
    List<Token> values = parseValues();
    order.add(part);

    switch (part) {
      case FREQ -> {
        Token v = single(part, values);
        frequency =
            Frequency.parse(v.text())
                .orElseThrow(
                    () -> parseError("unsupported frequency '" + v.text() + "'", v.span()));
      }
      case INTERVAL -> interval = parseInt(single(part, values));
      case COUNT -> count = parseInt(single(part, values));
      case UNTIL -> until = parseUntil(single(part, values));
      case WKST -> {
        Token v = single(part, values);
        weekStart =
            Weekday.parse(v.text())
                .orElseThrow(() -> parseError("unknown weekday '" + v.text() + "'", v.span()));
      }
      case BYDAY -> {
        List<WeekdayNum> days = new ArrayList<>(values.size());
        for (Token v : values) {
          days.add(parseWeekdayNum(v));
        }
        byWeekday = days;
      }
      case BYMONTHDAY -> byMonthDay = parseIntList(values);
      case BYMONTH -> byMonth = parseIntList(values);
    }
  }

  /** Parses a comma-separated value list. An empty value yields an empty list. */
  private List<Token> parseValues() throws RecurException {
    List<Token> values = new ArrayList<>();
    Token tok = peek();
    if (tok == null || tok.kind() == TokenKind.SEMICOLON) {
      return values;
    }
    values.add(expect(TokenKind.WORD, "expected value"));
    while (peek() != null && peek().kind() == TokenKind.COMMA) {
      pos++;
      values.add(expect(TokenKind.WORD, "expected value after ','"));
    }
    return values;
  }

  private Token single(RulePart part, List<Token> values) throws RecurException {
    if (values.isEmpty()) {
      throw parseError("missing value for " + part, previousSpan());
    }
    if (values.size() > 1) {
      throw parseError(part + " takes a single value", values.get(1).span());
    }
    return values.get(0);
  }

  private int parseInt(Token tok) throws RecurException {
    try {
      return Integer.parseInt(tok.text());
    } catch (NumberFormatException e) {
      throw parseError("expected integer, found '" + tok.text() + "'", tok.span());
    }
  }

  private List<Integer> parseIntList(List<Token> values) throws RecurException {
    List<Integer> result = new ArrayList<>(values.size());
    for (Token v : values) {
      result.add(parseInt(v));
    }
    return result;
  }

  private UntilSpec parseUntil(Token tok) throws RecurException {
    String text = tok.text();
    try {
      if (text.length() == 8) {
        return UntilSpec.date(LocalDate.parse(text, DATE));
      }
      if (text.length() == 15) {
        return UntilSpec.floating(LocalDateTime.parse(text, DATE_TIME));
      }
      if (text.length() == 16 && (text.charAt(15) == 'Z' || text.charAt(15) == 'z')) {
        LocalDateTime ldt = LocalDateTime.parse(text.substring(0, 15), DATE_TIME);
        return UntilSpec.utc(ldt.toInstant(ZoneOffset.UTC));
      }
    } catch (DateTimeParseException e) {
      throw parseError("invalid UNTIL value '" + text + "'", tok.span());
    }
    throw parseError(
        "invalid UNTIL value '" + text + "', expected YYYYMMDD or YYYYMMDDTHHMMSS[Z]", tok.span());
  }

  private WeekdayNum parseWeekdayNum(Token tok) throws RecurException {
    Matcher m = WEEKDAY_NUM.matcher(tok.text());
    if (!m.matches()) {
      throw parseError("invalid BYDAY value '" + tok.text() + "'", tok.span());
    }
    Weekday weekday =
        Weekday.parse(m.group(3))
            .orElseThrow(() -> parseError("unknown weekday '" + m.group(3) + "'", tok.span()));
    if (m.group(2) == null) {
      if (!m.group(1).isEmpty()) {
        throw parseError("sign without ordinal in '" + tok.text() + "'", tok.span());
      }
      return WeekdayNum.every(weekday);
    }
    int ordinal = Integer.parseInt(m.group(2));
    if (ordinal == 0) {
      throw parseError("BYDAY ordinal must not be zero", tok.span());
    }
    return WeekdayNum.nth("-".equals(m.group(1)) ? -ordinal : ordinal, weekday);
  }

  private Token peek() {
    return pos < tokens.size() ? tokens.get(pos) : null;
  }

  private Token expect(TokenKind kind, String message) throws RecurException {
    Token tok = peek();
    if (tok == null) {
      throw parseError("unexpected end of input: " + message, endSpan());
    }
    if (tok.kind() != kind) {
      throw parseError(message, tok.span());
    }
    pos++;
    return tok;
  }

  private Span previousSpan() {
    return pos > 0 ? tokens.get(pos - 1).span() : new Span(0, 0);
  }

  private Span endSpan() {
    return new Span(input.length(), input.length());
  }

  private RecurException parseError(String message, Span span) {
    return RecurException.parse(message, span, input, null);
  }
}
