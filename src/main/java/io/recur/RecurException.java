package io.recur;

import java.util.Optional;

/**
 * Exception thrown for malformed rules, unknown timezones, inconsistent templates, unbounded
 * expansion and booking races. Every instance describes exactly one bad input or one race.
 */
public final class RecurException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  /** An optional suggestion for fixing the error. */
  private final String suggestion;

  private RecurException(
      ErrorKind kind, String message, Span span, String input, String suggestion, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
    this.suggestion = suggestion;
  }

  /**
   * Creates a new lexer error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @return a new RecurException for a lexer error
   */
  public static RecurException lex(String message, Span span, String input) {
    return new RecurException(ErrorKind.LEX, message, span, input, null, null);
  }

  /**
   * Creates a new parser error.
   *
   * @param message the error message
   * @param span the location of the error in the input
   * @param input the original input string
   * @param suggestion an optional suggestion for fixing the error
   * @return a new RecurException for a parser error
   */
  public static RecurException parse(String message, Span span, String input, String suggestion) {
    return new RecurException(ErrorKind.PARSE, message, span, input, suggestion, null);
  }

  /**
   * Creates a new malformed-rule error.
   *
   * @param kind one of the rule error kinds
   * @param message the error message
   * @return a new RecurException for a rule error
   */
  public static RecurException rule(ErrorKind kind, String message) {
    if (!kind.isRuleError()) {
      throw new IllegalArgumentException("not a rule error kind: " + kind);
    }
    return new RecurException(kind, message, null, null, null, null);
  }

  /**
   * Creates a new unknown-timezone error.
   *
   * @param zoneId the rejected identifier
   * @return a new RecurException for an invalid timezone
   */
  public static RecurException invalidTimezone(String zoneId) {
    return new RecurException(
        ErrorKind.INVALID_TIMEZONE,
        "unknown IANA timezone '" + zoneId + "'",
        null,
        zoneId,
        null,
        null);
  }

  /**
   * Creates a new inconsistent-template error.
   *
   * @param message the error message
   * @param cause the underlying rule error, or null
   * @return a new RecurException for an invalid template
   */
  public static RecurException invalidTemplate(String message, Throwable cause) {
    return new RecurException(ErrorKind.INVALID_TEMPLATE, message, null, null, null, cause);
  }

  /**
   * Creates a new unbounded-expansion error.
   *
   * @param eventId the template whose expansion has no bound
   * @return a new RecurException for an unbounded expansion
   */
  public static RecurException unbounded(String eventId) {
    return new RecurException(
        ErrorKind.UNBOUNDED_EXPANSION,
        "expansion of '" + eventId + "' needs a range end, UNTIL or COUNT",
        null,
        null,
        null,
        null);
  }

  /**
   * Creates a new booking race error.
   *
   * @param message the error message
   * @return a new RecurException for a slot taken since it was reported free
   */
  public static RecurException slotNoLongerFree(String message) {
    return new RecurException(ErrorKind.SLOT_NO_LONGER_FREE, message, null, null, null, null);
  }

  /**
   * Creates a new booking transition error.
   *
   * @param message the error message
   * @return a new RecurException for an illegal booking status change
   */
  public static RecurException invalidTransition(String message) {
    return new RecurException(
        ErrorKind.INVALID_BOOKING_TRANSITION, message, null, null, null, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Returns a suggestion for fixing the error, if available.
   *
   * @return the suggestion, or empty if not available
   */
  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * Formats a rich error message with underline and optional suggestion.
   *
   * <p>For lex and parse errors with span and input, produces output like:
   *
   * <pre>
   * error: unknown frequency 'HOURLY'
   *   FREQ=HOURLY;COUNT=3
   *        ^^^^^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if ((kind == ErrorKind.LEX || kind == ErrorKind.PARSE) && span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");

      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));

      if (suggestion != null && !suggestion.isEmpty()) {
        sb.append(" try: \"").append(suggestion).append("\"");
      }

      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
